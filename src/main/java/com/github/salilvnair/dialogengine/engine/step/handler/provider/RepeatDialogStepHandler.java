package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.DialogLifecycle;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RepeatDialogStepHandler implements StepHandler {

    private final DialogLifecycle dialogLifecycle;

    @Override
    public StepKind kind() {
        return StepKind.REPEAT_DIALOG;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        dialogLifecycle.repeatDialog(context);
        return new StepResult.Continue();
    }
}
