package com.github.salilvnair.dialogengine.engine.step;

/**
 * @param value          expression for the pushed or removed element
 * @param resultProperty where pop/take/remove store the element they took out, may be null
 */
public record EditArray(ChangeType changeType, String arrayProperty, String value, String resultProperty)
        implements DialogStep {

    public enum ChangeType {
        PUSH,
        POP,
        TAKE,
        REMOVE,
        CLEAR
    }

    public static EditArray push(String arrayProperty, String value) {
        return new EditArray(ChangeType.PUSH, arrayProperty, value, null);
    }

    public static EditArray pop(String arrayProperty, String resultProperty) {
        return new EditArray(ChangeType.POP, arrayProperty, null, resultProperty);
    }

    public static EditArray take(String arrayProperty, String resultProperty) {
        return new EditArray(ChangeType.TAKE, arrayProperty, null, resultProperty);
    }

    public static EditArray remove(String arrayProperty, String value) {
        return new EditArray(ChangeType.REMOVE, arrayProperty, value, null);
    }

    public static EditArray clear(String arrayProperty) {
        return new EditArray(ChangeType.CLEAR, arrayProperty, null, null);
    }

    @Override
    public StepKind kind() {
        return StepKind.EDIT_ARRAY;
    }
}
