package com.github.salilvnair.dialogengine.engine.step;

/**
 * Evaluates {@code value} and writes the result to {@code property}.
 */
public record SetProperty(String property, String value) implements DialogStep {

    public static SetProperty of(String property, String value) {
        return new SetProperty(property, value);
    }

    @Override
    public StepKind kind() {
        return StepKind.SET_PROPERTY;
    }
}
