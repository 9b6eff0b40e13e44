package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.model.Activity;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.TraceActivity;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends a trace activity when {@code dialogengine.send-trace} is on. Without a value
 * expression a {@code memory} trace carries a snapshot of every scope.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TraceActivityStepHandler implements StepHandler {

    private final DialogEngineConfig config;
    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.TRACE_ACTIVITY;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        TraceActivity trace = (TraceActivity) step;
        if (!config.isSendTrace()) {
            log.debug("Trace '{}' skipped, send-trace is off", trace.name());
            return new StepResult.Continue();
        }
        Object value;
        if (trace.value() != null) {
            value = expressionEvaluator.evaluate(trace.value(), context.getMemory());
        } else if (TraceActivity.MEMORY_VALUE_TYPE.equals(trace.valueType())) {
            value = context.getMemory().snapshot();
        } else {
            value = null;
        }
        context.getTurn().send(Activity.trace(trace.name(), trace.valueType(), value));
        return new StepResult.Continue();
    }
}
