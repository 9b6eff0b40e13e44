package com.github.salilvnair.dialogengine.engine.hook;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;

/**
 * Observes step execution. Failures inside a hook are logged and never fail the turn.
 */
public interface DialogStepHook {

    default boolean supports(StepKind kind, DialogContext context) {
        return true;
    }

    default void beforeStep(StepKind kind, DialogContext context) {
    }

    default void afterStep(StepKind kind, DialogContext context, StepResult result) {
    }

    default void onStepError(StepKind kind, DialogContext context, Throwable error) {
    }
}
