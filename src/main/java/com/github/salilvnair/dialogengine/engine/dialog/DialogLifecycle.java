package com.github.salilvnair.dialogengine.engine.dialog;

import com.github.salilvnair.dialogengine.audit.AuditService;
import com.github.salilvnair.dialogengine.audit.DialogAuditStage;
import com.github.salilvnair.dialogengine.engine.constants.MemoryKeys;
import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.event.EventDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stack operations shared by the lifecycle steps and the turn loop. Each operation
 * first cancels instances above the active one, so an interrupting ancestor acts on
 * its own position in the stack.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DialogLifecycle {

    private final EventDispatcher eventDispatcher;
    private final AuditService audit;

    public DialogInstance beginDialog(DialogContext context, Dialog dialog, Map<String, Object> options, String resultProperty) {
        cancelAbove(context);
        DialogInstance instance = DialogInstance.create(dialog.getId(), resultProperty);
        if (options != null && !options.isEmpty()) {
            instance.getState().put(MemoryKeys.DIALOG_OPTIONS, new LinkedHashMap<>(options));
        }
        context.push(instance);
        log.info("Dialog begin: {} (depth {})", dialog.getId(), context.getStack().depth());
        audit.audit(DialogAuditStage.DIALOG_BEGIN, context.getConversationKey(),
                payload(dialog.getId(), context.getStack().depth()));
        eventDispatcher.onBeginDialog(context, options == null ? Map.of() : options);
        return instance;
    }

    /**
     * Pops the active instance and pushes {@code dialog} in its place. The new instance
     * starts with fresh state and returns its result wherever the replaced one would have.
     */
    public DialogInstance replaceDialog(DialogContext context, Dialog dialog, Map<String, Object> options) {
        cancelAbove(context);
        DialogInstance replaced = context.popActive();
        log.info("Dialog replace: {} -> {}", replaced.getDialogId(), dialog.getId());
        audit.audit(DialogAuditStage.DIALOG_END, context.getConversationKey(),
                payload(replaced.getDialogId(), context.getStack().depth()));
        return beginDialog(context, dialog, options, replaced.getResultProperty());
    }

    /**
     * Pops the active instance. The result lands in the caller's result property, or
     * becomes the turn's completed result when the root ends.
     */
    public void endDialog(DialogContext context, Object result) {
        cancelAbove(context);
        DialogInstance ended = context.popActive();
        log.info("Dialog end: {} (depth {})", ended.getDialogId(), context.getStack().depth());
        audit.audit(DialogAuditStage.DIALOG_END, context.getConversationKey(),
                payload(ended.getDialogId(), context.getStack().depth()));
        context.getMemory().set(MemoryKeys.TURN_LAST_RESULT, result);
        if (context.getStack().isEmpty()) {
            context.setCompletedResult(result);
            return;
        }
        if (ended.getResultProperty() != null) {
            context.getMemory().set(ended.getResultProperty(), result);
        }
    }

    /**
     * Restarts the active instance from its first step, keeping its dialog-scope state.
     */
    @SuppressWarnings("unchecked")
    public void repeatDialog(DialogContext context) {
        cancelAbove(context);
        DialogInstance instance = context.activeInstance();
        instance.resetCursor();
        log.info("Dialog repeat: {}", instance.getDialogId());
        Object options = instance.getState().get(MemoryKeys.DIALOG_OPTIONS);
        eventDispatcher.onBeginDialog(context, options instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of());
    }

    private void cancelAbove(DialogContext context) {
        List<DialogInstance> cancelled = context.cancelAboveActive();
        for (DialogInstance instance : cancelled) {
            log.info("Dialog cancelled: {}", instance.getDialogId());
            audit.audit(DialogAuditStage.DIALOG_CANCELLED, context.getConversationKey(),
                    payload(instance.getDialogId(), context.getStack().depth()));
        }
    }

    private Map<String, Object> payload(String dialogId, int depth) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dialogId", dialogId);
        payload.put("depth", depth);
        return payload;
    }
}
