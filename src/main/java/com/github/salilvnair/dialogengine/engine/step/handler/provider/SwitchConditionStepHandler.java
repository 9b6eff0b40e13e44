package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.dialog.StepRef;
import com.github.salilvnair.dialogengine.engine.helper.SequenceValues;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.SwitchCondition;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class SwitchConditionStepHandler implements StepHandler {

    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.SWITCH_CONDITION;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        SwitchCondition switchCondition = (SwitchCondition) step;
        Object value = expressionEvaluator.evaluate(switchCondition.condition(), context.getMemory());

        String branch = SwitchCondition.DEFAULT_BRANCH;
        for (int i = 0; i < switchCondition.cases().size(); i++) {
            if (SequenceValues.matchesLiteral(value, switchCondition.cases().get(i).value())) {
                branch = SwitchCondition.caseBranch(i);
                break;
            }
        }
        log.debug("Switch '{}' = {} -> {}", switchCondition.condition(), value, branch);

        List<StepRef> refs = context.activeDialog().branchRefs(context.getCurrentRef(), branch);
        if (!refs.isEmpty()) {
            context.activeInstance().pushFrame(StepFrame.sequence(refs));
        }
        return new StepResult.Continue();
    }
}
