package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.dialog.StepRef;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.IfCondition;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class IfConditionStepHandler implements StepHandler {

    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.IF_CONDITION;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        IfCondition ifCondition = (IfCondition) step;
        boolean holds = expressionEvaluator.evaluateCondition(ifCondition.condition(), context.getMemory());
        String branch = holds ? IfCondition.THEN_BRANCH : IfCondition.ELSE_BRANCH;
        List<StepRef> refs = context.activeDialog().branchRefs(context.getCurrentRef(), branch);
        if (!refs.isEmpty()) {
            context.activeInstance().pushFrame(StepFrame.sequence(refs));
        }
        return new StepResult.Continue();
    }
}
