package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import org.springframework.stereotype.Component;

@Component
public class EndTurnStepHandler implements StepHandler {

    @Override
    public StepKind kind() {
        return StepKind.END_TURN;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        return new StepResult.Suspend();
    }
}
