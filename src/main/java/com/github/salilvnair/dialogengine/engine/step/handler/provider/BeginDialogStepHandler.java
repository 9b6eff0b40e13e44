package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.DialogLifecycle;
import com.github.salilvnair.dialogengine.engine.step.BeginDialog;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BeginDialogStepHandler implements StepHandler {

    private final DialogLifecycle dialogLifecycle;
    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.BEGIN_DIALOG;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        BeginDialog beginDialog = (BeginDialog) step;
        Dialog target = context.getDialogs().find(beginDialog.dialogId());
        dialogLifecycle.beginDialog(context, target,
                DialogOptions.evaluate(beginDialog.options(), expressionEvaluator, context.getMemory()),
                beginDialog.resultProperty());
        return new StepResult.Continue();
    }
}
