package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.model.Activity;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.SendOutput;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.template.LanguageGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SendOutputStepHandler implements StepHandler {

    private final LanguageGenerator languageGenerator;

    @Override
    public StepKind kind() {
        return StepKind.SEND_OUTPUT;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        SendOutput sendOutput = (SendOutput) step;
        String text = languageGenerator.resolve(sendOutput.template(), context.getMemory());
        context.getTurn().send(Activity.message(text));
        return new StepResult.Continue();
    }
}
