package com.github.salilvnair.dialogengine.engine.step;

public record EmitEvent(String eventName, String value, boolean bubble) implements DialogStep {

    public static EmitEvent of(String eventName, boolean bubble) {
        return new EmitEvent(eventName, null, bubble);
    }

    @Override
    public StepKind kind() {
        return StepKind.EMIT_EVENT;
    }
}
