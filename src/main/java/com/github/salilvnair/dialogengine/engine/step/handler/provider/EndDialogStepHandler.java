package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.DialogLifecycle;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.EndDialog;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import com.github.salilvnair.dialogengine.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EndDialogStepHandler implements StepHandler {

    private final DialogLifecycle dialogLifecycle;
    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.END_DIALOG;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        EndDialog endDialog = (EndDialog) step;
        Object result = endDialog.value() == null
                ? null
                : JsonUtil.deepCopy(expressionEvaluator.evaluate(endDialog.value(), context.getMemory()));
        dialogLifecycle.endDialog(context, result);
        return new StepResult.Continue();
    }
}
