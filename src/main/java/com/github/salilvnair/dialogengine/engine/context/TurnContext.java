package com.github.salilvnair.dialogengine.engine.context;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.model.Activity;
import com.github.salilvnair.dialogengine.engine.model.RecognizerResult;
import com.github.salilvnair.dialogengine.transport.ActivitySender;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed per-turn fields plus the {@code turn} memory scope. Discarded at turn end.
 */
@Getter
public class TurnContext {

    private final String conversationKey;
    private final Activity activity;
    private final String locale;
    private final Map<String, Object> state = new LinkedHashMap<>();
    private final List<Activity> replies = new ArrayList<>();
    private final ActivitySender sender;

    @Setter
    private boolean activityConsumed;
    @Setter
    private RecognizerResult recognized;
    private int stepsExecuted;

    public TurnContext(String conversationKey, Activity activity, String locale, ActivitySender sender) {
        this.conversationKey = conversationKey;
        this.activity = activity;
        this.locale = locale;
        this.sender = sender;
    }

    public void send(Activity reply) {
        if (reply.getLocale() == null) {
            reply.setLocale(locale);
        }
        try {
            sender.send(conversationKey, reply);
        } catch (DialogEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DialogEngineException(DialogEngineErrorCode.ACTIVITY_SEND_FAILED,
                    "Failed to send " + reply.getType() + " activity: " + e.getMessage(), e);
        }
        replies.add(reply);
    }

    public int countStep(int maxStepsPerTurn) {
        if (Thread.currentThread().isInterrupted()) {
            throw new DialogEngineException(DialogEngineErrorCode.TURN_CANCELLED);
        }
        stepsExecuted++;
        if (stepsExecuted > maxStepsPerTurn) {
            throw new DialogEngineException(DialogEngineErrorCode.STEP_LIMIT_EXCEEDED,
                    "Turn executed more than " + maxStepsPerTurn + " steps");
        }
        return stepsExecuted;
    }
}
