package com.github.salilvnair.dialogengine.engine.step;

public record DeleteProperty(String property) implements DialogStep {

    public static DeleteProperty of(String property) {
        return new DeleteProperty(property);
    }

    @Override
    public StepKind kind() {
        return StepKind.DELETE_PROPERTY;
    }
}
