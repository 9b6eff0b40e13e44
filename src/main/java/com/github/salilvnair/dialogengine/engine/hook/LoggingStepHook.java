package com.github.salilvnair.dialogengine.engine.hook;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingStepHook implements DialogStepHook {

    @Override
    public boolean supports(StepKind kind, DialogContext context) {
        return log.isDebugEnabled();
    }

    @Override
    public void beforeStep(StepKind kind, DialogContext context) {
        log.debug("[{}] step enter: {} {} in {}", context.getConversationKey(), kind,
                context.getCurrentRef(), context.activeInstance().getDialogId());
    }

    @Override
    public void afterStep(StepKind kind, DialogContext context, StepResult result) {
        log.debug("[{}] step exit: {} -> {}", context.getConversationKey(), kind, result.getClass().getSimpleName());
    }

    @Override
    public void onStepError(StepKind kind, DialogContext context, Throwable error) {
        log.debug("[{}] step error: {} {}", context.getConversationKey(), kind, error.getMessage());
    }
}
