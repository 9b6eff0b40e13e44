package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.InitProperty;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;

@Component
public class InitPropertyStepHandler implements StepHandler {

    @Override
    public StepKind kind() {
        return StepKind.INIT_PROPERTY;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        InitProperty initProperty = (InitProperty) step;
        Object empty = initProperty.type() == InitProperty.PropertyType.ARRAY
                ? new ArrayList<>()
                : new LinkedHashMap<String, Object>();
        context.getMemory().set(initProperty.property(), empty);
        return new StepResult.Continue();
    }
}
