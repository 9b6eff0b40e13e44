package com.github.salilvnair.dialogengine.engine.step;

public record TraceActivity(String name, String valueType, String value) implements DialogStep {

    public static final String MEMORY_VALUE_TYPE = "memory";

    public static TraceActivity memory(String name) {
        return new TraceActivity(name, MEMORY_VALUE_TYPE, null);
    }

    @Override
    public StepKind kind() {
        return StepKind.TRACE_ACTIVITY;
    }
}
