package com.github.salilvnair.dialogengine.engine.event;

import com.github.salilvnair.dialogengine.audit.AuditService;
import com.github.salilvnair.dialogengine.audit.DialogAuditStage;
import com.github.salilvnair.dialogengine.engine.constants.MemoryKeys;
import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.DialogInstance;
import com.github.salilvnair.dialogengine.engine.model.DialogEvent;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.rule.RuleMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Offers events to single stack entries and walks unconsumed events toward the root.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventBubbler {

    private final RuleMatcher ruleMatcher;
    private final AuditService audit;

    /**
     * Offers the event to the rules of the instance at {@code index}. On a match the
     * rule's steps are queued on that instance's cursor and the instance becomes active;
     * otherwise the active instance is left unchanged.
     */
    public boolean offer(DialogContext context, int index, DialogEvent event) {
        DialogInstance instance = context.getStack().get(index);
        Dialog dialog = context.dialogOf(instance);
        int previous = context.getActiveIndex();
        context.activate(index);
        context.getMemory().set(MemoryKeys.TURN_DIALOG_EVENT, event.toMemoryValue());

        Optional<DialogRule> rule = ruleMatcher.selectRule(dialog.getRules(), event, context.getMemory());
        if (rule.isEmpty()) {
            context.activate(previous);
            return false;
        }
        String listId = dialog.ruleListId(rule.get());
        instance.queueSteps(dialog.refs(listId), index < context.getStack().depth() - 1);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dialogId", dialog.getId());
        payload.put("event", event.getName());
        payload.put("rule", listId);
        payload.put("trigger", rule.get().triggerType().name());
        payload.put("names", rule.get().names());
        payload.put("stackIndex", index);
        audit.audit(DialogAuditStage.RULE_MATCHED, context.getConversationKey(), payload);
        log.info("Rule matched: dialog={}, event={}, rule={}", dialog.getId(), event.getName(), listId);
        return true;
    }

    /**
     * Re-offers the event to every caller of the instance at {@code fromIndex}, nearest
     * first. Each hop sees its own copy of the payload.
     *
     * @return whether some ancestor consumed the event
     */
    public boolean bubble(DialogContext context, DialogEvent event, int fromIndex) {
        for (int index = fromIndex - 1; index >= 0; index--) {
            DialogEvent hop = event.copy();
            audit.audit(DialogAuditStage.EVENT_BUBBLED, context.getConversationKey(),
                    Map.of("event", String.valueOf(event.getName()), "stackIndex", index));
            if (offer(context, index, hop)) {
                return true;
            }
        }
        log.warn("Event '{}' reached the bottom of the dialog stack unconsumed (conversation {})",
                event.getName(), context.getConversationKey());
        audit.audit(DialogAuditStage.BUBBLE_EXHAUSTED, context.getConversationKey(),
                Map.of("event", String.valueOf(event.getName()), "fromIndex", fromIndex));
        return false;
    }
}
