package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.event.EventBubbler;
import com.github.salilvnair.dialogengine.engine.model.DialogEvent;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.EmitEvent;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Raises a named event on the active dialog. If a rule somewhere consumes it, the
 * consuming instance becomes active and runs the rule's steps next; the emitter's
 * remaining steps run once control returns to it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmitEventStepHandler implements StepHandler {

    private final EventBubbler eventBubbler;
    private final ExpressionEvaluator expressionEvaluator;

    @Override
    public StepKind kind() {
        return StepKind.EMIT_EVENT;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        EmitEvent emitEvent = (EmitEvent) step;
        Object value = emitEvent.value() == null
                ? null
                : expressionEvaluator.evaluate(emitEvent.value(), context.getMemory());
        DialogEvent event = DialogEvent.of(emitEvent.eventName(), value, emitEvent.bubble());
        int index = context.getActiveIndex();

        boolean consumed = eventBubbler.offer(context, index, event)
                || (event.isBubble() && eventBubbler.bubble(context, event, index));
        if (!consumed) {
            log.debug("Event '{}' emitted by {} was not consumed", event.getName(), context.activeInstance().getDialogId());
        }
        return new StepResult.Continue();
    }
}
