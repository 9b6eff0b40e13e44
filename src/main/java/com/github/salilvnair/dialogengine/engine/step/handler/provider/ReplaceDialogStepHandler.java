package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.DialogLifecycle;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.ReplaceDialog;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReplaceDialogStepHandler implements StepHandler {

    private final DialogLifecycle dialogLifecycle;
    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.REPLACE_DIALOG;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        ReplaceDialog replaceDialog = (ReplaceDialog) step;
        Dialog target = context.getDialogs().find(replaceDialog.dialogId());
        dialogLifecycle.replaceDialog(context, target,
                DialogOptions.evaluate(replaceDialog.options(), expressionEvaluator, context.getMemory()));
        return new StepResult.Continue();
    }
}
