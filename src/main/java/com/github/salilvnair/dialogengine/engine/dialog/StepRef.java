package com.github.salilvnair.dialogengine.engine.dialog;

/**
 * Index based reference into the step-list arena of a {@link Dialog}.
 */
public record StepRef(String listId, int index) {

    public static StepRef of(String listId, int index) {
        return new StepRef(listId, index);
    }
}
