package com.github.salilvnair.dialogengine.engine.provider;

import com.github.salilvnair.dialogengine.audit.AuditService;
import com.github.salilvnair.dialogengine.audit.DialogAuditStage;
import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.engine.constants.MemoryKeys;
import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.context.TurnContext;
import com.github.salilvnair.dialogengine.engine.core.DialogEngine;
import com.github.salilvnair.dialogengine.engine.dialog.DialogLifecycle;
import com.github.salilvnair.dialogengine.engine.dialog.DialogSet;
import com.github.salilvnair.dialogengine.engine.event.EventDispatcher;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.executor.ExecutionStatus;
import com.github.salilvnair.dialogengine.engine.executor.StepExecutor;
import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import com.github.salilvnair.dialogengine.engine.model.Activity;
import com.github.salilvnair.dialogengine.engine.model.ConversationSnapshot;
import com.github.salilvnair.dialogengine.engine.model.TurnRequest;
import com.github.salilvnair.dialogengine.engine.model.TurnResult;
import com.github.salilvnair.dialogengine.engine.model.TurnStatus;
import com.github.salilvnair.dialogengine.service.DialogStateStore;
import com.github.salilvnair.dialogengine.transport.ActivitySender;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one turn per call for a single root dialog.
 * <p>
 * A turn loads the conversation snapshot, routes the activity, drives the executor
 * and saves the snapshot once at the end. A failed turn saves nothing, so the next
 * turn starts from the last good snapshot.
 */
@Slf4j
@RequiredArgsConstructor
public class DialogManager implements DialogEngine {

    @Getter
    private final DialogSet dialogs;
    private final DialogLifecycle dialogLifecycle;
    private final EventDispatcher eventDispatcher;
    private final StepExecutor stepExecutor;
    private final DialogStateStore stateStore;
    private final ActivitySender activitySender;
    private final AuditService audit;
    private final DialogEngineConfig config;

    @Override
    public TurnResult process(TurnRequest request) {
        validate(request);
        String conversationKey = request.getConversationKey();
        Activity activity = request.getActivity();

        ConversationSnapshot snapshot = stateStore.load(conversationKey).orElseGet(ConversationSnapshot::new);
        String locale = (activity.getLocale() == null || activity.getLocale().isBlank()
                ? config.getDefaultLocale()
                : activity.getLocale()).toLowerCase(Locale.ROOT);
        TurnContext turn = new TurnContext(conversationKey, activity, locale, activitySender);
        DialogMemory memory = new DialogMemory(snapshot.getUserState(), snapshot.getConversationState(), turn.getState());
        memory.set(MemoryKeys.TURN_ACTIVITY, activity.toMemoryValue());
        memory.set(MemoryKeys.TURN_LOCALE, locale);
        DialogContext context = new DialogContext(conversationKey, dialogs, snapshot.getStack(), memory, turn);

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("activityType", activity.getType() == null ? null : activity.getType().name());
        started.put("text", activity.getText());
        started.put("stackDepth", snapshot.getStack().depth());
        audit.audit(DialogAuditStage.TURN_STARTED, conversationKey, started);

        try {
            if (snapshot.getStack().isEmpty()) {
                dialogLifecycle.beginDialog(context, dialogs.getRoot(), Map.of(), null);
            } else {
                eventDispatcher.routeActivity(context);
            }
            ExecutionStatus status = stepExecutor.run(context);

            TurnResult result;
            if (status == ExecutionStatus.COMPLETED) {
                snapshot.getStack().clear();
                audit.audit(DialogAuditStage.STACK_COMPLETED, conversationKey,
                        payload("steps", turn.getStepsExecuted(), "replies", turn.getReplies().size()));
                result = new TurnResult(conversationKey, TurnStatus.STACK_COMPLETED, turn.getReplies(),
                        context.getCompletedResult(), 0);
            } else {
                audit.audit(DialogAuditStage.TURN_SUSPENDED, conversationKey,
                        payload("steps", turn.getStepsExecuted(), "stackDepth", snapshot.getStack().depth()));
                result = new TurnResult(conversationKey, TurnStatus.SUSPENDED, turn.getReplies(),
                        null, snapshot.getStack().depth());
            }
            stateStore.save(conversationKey, snapshot);
            return result;
        } catch (DialogEngineException e) {
            Map<String, Object> faulted = new LinkedHashMap<>();
            faulted.put("errorCode", e.getErrorCode());
            faulted.put("category", e.getCategory() == null ? null : e.getCategory().name());
            faulted.put("errorMessage", String.valueOf(e.getMessage()));
            if (e.getMetaData() != null) {
                faulted.put("_errorMeta", e.getMetaData());
            }
            audit.audit(DialogAuditStage.TURN_FAULTED, conversationKey, faulted);
            log.error("Turn faulted for conversation {}: {} {}", conversationKey, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    @Override
    public void reset(String conversationKey) {
        stateStore.delete(conversationKey);
        log.info("Conversation {} reset", conversationKey);
    }

    private void validate(TurnRequest request) {
        if (request == null || request.getConversationKey() == null || request.getConversationKey().isBlank()) {
            throw new DialogEngineException(DialogEngineErrorCode.INVALID_TURN_REQUEST, "Conversation key is required");
        }
        if (request.getActivity() == null) {
            throw new DialogEngineException(DialogEngineErrorCode.INVALID_TURN_REQUEST, "Activity is required");
        }
    }

    private Map<String, Object> payload(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(k1, v1);
        payload.put(k2, v2);
        return payload;
    }
}
