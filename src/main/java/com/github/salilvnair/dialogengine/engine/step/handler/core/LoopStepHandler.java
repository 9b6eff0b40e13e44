package com.github.salilvnair.dialogengine.engine.step.handler.core;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;

public interface LoopStepHandler extends StepHandler {

    /**
     * Called when a loop frame runs out of steps. Rebinds the loop variables and refills
     * the frame for the next iteration.
     *
     * @return false once the loop is done and the frame can be popped
     */
    boolean nextIteration(DialogContext context, StepFrame frame);
}
