package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.SetProperty;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import com.github.salilvnair.dialogengine.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SetPropertyStepHandler implements StepHandler {

    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.SET_PROPERTY;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        SetProperty setProperty = (SetProperty) step;
        Object value = expressionEvaluator.evaluate(setProperty.value(), context.getMemory());
        // copy so two paths never share one mutable container
        context.getMemory().set(setProperty.property(), JsonUtil.deepCopy(value));
        return new StepResult.Continue();
    }
}
