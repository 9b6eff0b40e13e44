package com.github.salilvnair.dialogengine.engine.event;

import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.engine.constants.DialogEvents;
import com.github.salilvnair.dialogengine.engine.constants.MemoryKeys;
import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.DialogInstance;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.model.Activity;
import com.github.salilvnair.dialogengine.engine.model.ActivityType;
import com.github.salilvnair.dialogengine.engine.model.DialogEvent;
import com.github.salilvnair.dialogengine.engine.model.RecognizerResult;
import com.github.salilvnair.dialogengine.intent.Recognizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns the inbound activity into a dialog event and routes it through the stack.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventDispatcher {

    private final EventBubbler eventBubbler;
    private final DialogEngineConfig config;

    /**
     * Routes the turn's activity into a non-empty stack.
     * <ol>
     *     <li>The top instance's rules get the first chance.</li>
     *     <li>Unknown utterances feed a parked cursor before anything else.</li>
     *     <li>Other events bubble to ancestors.</li>
     *     <li>If nobody consumed it, a parked cursor on top simply resumes.</li>
     * </ol>
     *
     * @return whether a rule consumed the activity
     */
    public boolean routeActivity(DialogContext context) {
        int top = context.getStack().depth() - 1;
        DialogInstance instance = context.getStack().get(top);
        DialogEvent event = activityEvent(context, top);

        if (event.named(DialogEvents.UNKNOWN_INTENT) && instance.hasPendingSteps()) {
            log.debug("Unknown utterance resumes the cursor of dialog {}", instance.getDialogId());
            return false;
        }
        boolean consumed = eventBubbler.offer(context, top, event)
                || (event.isBubble() && eventBubbler.bubble(context, event, top));
        context.getTurn().setActivityConsumed(consumed);
        return consumed;
    }

    /**
     * Starts a freshly pushed (or repeated) active instance: a {@code beginDialog} rule
     * wins, then the dialog's own steps, then the turn's activity offered to its rules.
     */
    public void onBeginDialog(DialogContext context, Map<String, Object> options) {
        int index = context.getActiveIndex();
        DialogInstance instance = context.activeInstance();
        if (eventBubbler.offer(context, index, DialogEvent.of(DialogEvents.BEGIN_DIALOG, options, false))) {
            return;
        }
        Dialog dialog = context.activeDialog();
        if (!dialog.getSteps().isEmpty()) {
            instance.pushFrame(StepFrame.sequence(dialog.refs(Dialog.STEPS_LIST)));
            return;
        }
        DialogEvent event = activityEvent(context, index);
        if (eventBubbler.offer(context, index, event)) {
            context.getTurn().setActivityConsumed(true);
        }
    }

    /**
     * Event for the turn's activity, recognized with the nearest recognizer at or
     * below {@code index}. Recognition happens once per turn.
     */
    DialogEvent activityEvent(DialogContext context, int index) {
        Activity activity = context.getTurn().getActivity();
        ActivityType type = activity.getType() == null ? ActivityType.MESSAGE : activity.getType();
        return switch (type) {
            case CONVERSATION_UPDATE -> DialogEvent.of(DialogEvents.CONVERSATION_UPDATE, activity.getValue(), true);
            case EVENT -> DialogEvent.of(activity.getName(), activity.getValue(), true);
            case TRACE -> DialogEvent.of(DialogEvents.ACTIVITY_RECEIVED, activity.getValue(), false);
            case MESSAGE -> messageEvent(context, index);
        };
    }

    private DialogEvent messageEvent(DialogContext context, int index) {
        RecognizerResult result = context.getTurn().getRecognized();
        if (result == null) {
            result = recognize(context, index);
            context.getTurn().setRecognized(result);
            context.getMemory().set(MemoryKeys.TURN_RECOGNIZED, result.toMemoryValue());
        }
        boolean confident = result.intent() != null && result.score() >= config.getRecognizer().getMinScore();
        return confident ? DialogEvent.recognizedIntent(result) : DialogEvent.unknownIntent(result);
    }

    private RecognizerResult recognize(DialogContext context, int index) {
        String text = context.getTurn().getActivity().getText();
        for (int i = index; i >= 0; i--) {
            Recognizer recognizer = context.dialogOf(context.getStack().get(i)).getRecognizer();
            if (recognizer == null) {
                continue;
            }
            try {
                RecognizerResult result = recognizer.recognize(text, context.getTurn().getLocale());
                return result == null ? RecognizerResult.none(text) : result;
            } catch (DialogEngineException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DialogEngineException(DialogEngineErrorCode.RECOGNIZER_FAILED,
                        "Recognizer of dialog '" + context.getStack().get(i).getDialogId() + "' failed: " + e.getMessage(), e);
            }
        }
        return RecognizerResult.none(text);
    }
}
