package com.github.salilvnair.dialogengine.engine.step;

/**
 * @param value optional expression for the result handed to the caller
 */
public record EndDialog(String value) implements DialogStep {

    public static EndDialog of() {
        return new EndDialog(null);
    }

    public static EndDialog of(String value) {
        return new EndDialog(value);
    }

    @Override
    public StepKind kind() {
        return StepKind.END_DIALOG;
    }
}
