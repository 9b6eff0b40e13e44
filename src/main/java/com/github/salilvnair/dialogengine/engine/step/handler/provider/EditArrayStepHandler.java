package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.helper.SequenceValues;
import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.EditArray;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import com.github.salilvnair.dialogengine.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Push, pop, take, remove or clear on a list in memory. A missing list is created.
 */
@Component
@RequiredArgsConstructor
public class EditArrayStepHandler implements StepHandler {

    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.EDIT_ARRAY;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        EditArray editArray = (EditArray) step;
        DialogMemory memory = context.getMemory();
        List<Object> items = SequenceValues.asList(memory.get(editArray.arrayProperty()), editArray.arrayProperty());

        Object taken = null;
        switch (editArray.changeType()) {
            case PUSH -> items.add(JsonUtil.deepCopy(expressionEvaluator.evaluate(editArray.value(), memory)));
            case POP -> taken = items.isEmpty() ? null : items.remove(items.size() - 1);
            case TAKE -> taken = items.isEmpty() ? null : items.remove(0);
            case REMOVE -> {
                Object target = expressionEvaluator.evaluate(editArray.value(), memory);
                for (int i = 0; i < items.size(); i++) {
                    if (SequenceValues.looselyEquals(items.get(i), target)) {
                        taken = items.remove(i);
                        break;
                    }
                }
            }
            case CLEAR -> items.clear();
        }
        memory.set(editArray.arrayProperty(), items);
        if (editArray.resultProperty() != null) {
            memory.set(editArray.resultProperty(), taken);
        }
        return new StepResult.Continue();
    }
}
