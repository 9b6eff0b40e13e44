package com.github.salilvnair.dialogengine.engine.step.handler.core;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.StepKind;

/**
 * Executes one step kind. The executor has already moved the cursor past the step
 * when {@link #execute} is called; {@link DialogContext#getCurrentFrame()} is the
 * frame it came from.
 */
public interface StepHandler {

    StepKind kind();

    StepResult execute(DialogContext context, DialogStep step);
}
