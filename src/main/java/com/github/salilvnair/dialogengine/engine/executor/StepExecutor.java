package com.github.salilvnair.dialogengine.engine.executor;

import com.github.salilvnair.dialogengine.audit.AuditService;
import com.github.salilvnair.dialogengine.audit.DialogAuditStage;
import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.DialogInstance;
import com.github.salilvnair.dialogengine.engine.dialog.DialogLifecycle;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.dialog.StepRef;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.hook.DialogStepHook;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.engine.step.handler.factory.StepHandlerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives the active instance's cursor until the turn suspends or the stack empties.
 * <p>
 * An instance whose cursor runs dry either auto-ends (handing
 * {@code defaultResultProperty} to its caller) or waits for the next activity. An
 * ancestor that ran a consumed rule hands control back to the top of the stack once
 * its queued steps are done.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StepExecutor {

    private final StepHandlerFactory handlerFactory;
    private final DialogLifecycle dialogLifecycle;
    private final DialogEngineConfig config;
    private final List<DialogStepHook> stepHooks;
    private final AuditService audit;

    public ExecutionStatus run(DialogContext context) {
        while (true) {
            if (context.getStack().isEmpty()) {
                return ExecutionStatus.COMPLETED;
            }
            DialogInstance instance = context.activeInstance();
            StepFrame frame = instance.topFrame();

            if (frame == null) {
                if (!context.isActiveOnTop()) {
                    context.activateTop();
                    continue;
                }
                Dialog dialog = context.activeDialog();
                if (dialog.isAutoEndDialog()) {
                    dialogLifecycle.endDialog(context, context.getMemory().get(dialog.getDefaultResultProperty()));
                    continue;
                }
                return ExecutionStatus.WAITING;
            }

            if (frame.exhausted()) {
                if (frame.getLoop() != null
                        && handlerFactory.loopHandler(frame.getLoop().getKind()).nextIteration(context, frame)) {
                    continue;
                }
                instance.popFrame();
                if (frame.isInterruption() && !context.isActiveOnTop()) {
                    context.activateTop();
                }
                continue;
            }

            StepRef ref = frame.advance();
            DialogStep step = context.activeDialog().step(ref);
            context.getTurn().countStep(config.getMaxStepsPerTurn());
            context.enterStep(frame, ref);

            StepResult result = execute(context, step);
            if (result instanceof StepResult.AwaitInput) {
                frame.pushFront(ref);
                return ExecutionStatus.WAITING;
            }
            if (result instanceof StepResult.Suspend) {
                return ExecutionStatus.WAITING;
            }
        }
    }

    private StepResult execute(DialogContext context, DialogStep step) {
        StepKind kind = step.kind();
        String dialogId = context.activeInstance().getDialogId();
        StepRef ref = context.getCurrentRef();
        for (DialogStepHook hook : stepHooks) {
            runHookSafely(() -> {
                if (hook.supports(kind, context)) {
                    hook.beforeStep(kind, context);
                }
            }, hook, "beforeStep", kind, context);
        }
        StepResult result;
        try {
            result = handlerFactory.get(kind).execute(context, step);
        } catch (DialogEngineException e) {
            onError(context, kind, dialogId, ref, e);
            throw e.withMetaData(errorMeta(context, kind, dialogId, ref));
        } catch (RuntimeException e) {
            onError(context, kind, dialogId, ref, e);
            throw new DialogEngineException(DialogEngineErrorCode.STEP_EXECUTION_FAILED,
                    kind + " step failed in dialog '" + dialogId + "': " + e.getMessage(), e)
                    .withMetaData(errorMeta(context, kind, dialogId, ref));
        }
        StepResult outcome = result;
        for (DialogStepHook hook : stepHooks) {
            runHookSafely(() -> {
                if (hook.supports(kind, context)) {
                    hook.afterStep(kind, context, outcome);
                }
            }, hook, "afterStep", kind, context);
        }
        return result;
    }

    private void onError(DialogContext context, StepKind kind, String dialogId, StepRef ref, RuntimeException error) {
        for (DialogStepHook hook : stepHooks) {
            runHookSafely(() -> {
                if (hook.supports(kind, context)) {
                    hook.onStepError(kind, context, error);
                }
            }, hook, "onStepError", kind, context);
        }
        Map<String, Object> payload = errorMeta(context, kind, dialogId, ref);
        payload.put("errorType", error.getClass().getSimpleName());
        payload.put("errorMessage", String.valueOf(error.getMessage()));
        audit.audit(DialogAuditStage.STEP_ERROR, context.getConversationKey(), payload);
    }

    private Map<String, Object> errorMeta(DialogContext context, StepKind kind, String dialogId, StepRef ref) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("conversationKey", context.getConversationKey());
        meta.put("dialogId", dialogId);
        meta.put("stepKind", kind.name());
        meta.put("stepList", ref.listId());
        meta.put("stepIndex", ref.index());
        return meta;
    }

    private void runHookSafely(Runnable hookCall, DialogStepHook hook, String phase, StepKind kind, DialogContext context) {
        try {
            hookCall.run();
        } catch (Exception ex) {
            log.warn("DialogStepHook {} failed during {} for step {} conversation={}: {}",
                    hook.getClass().getSimpleName(), phase, kind, context.getConversationKey(), ex.getMessage());
            audit.audit(DialogAuditStage.STEP_HOOK_ERROR, context.getConversationKey(),
                    Map.of("step", kind.name(),
                            "phase", phase,
                            "hookClass", hook.getClass().getName(),
                            "errorType", ex.getClass().getSimpleName(),
                            "errorMessage", String.valueOf(ex.getMessage())));
        }
    }
}
