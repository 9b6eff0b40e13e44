package com.github.salilvnair.dialogengine.engine.core;

import com.github.salilvnair.dialogengine.engine.model.Activity;
import com.github.salilvnair.dialogengine.engine.model.TurnRequest;
import com.github.salilvnair.dialogengine.engine.model.TurnResult;

public interface DialogEngine {

    TurnResult process(TurnRequest request);

    default TurnResult process(String conversationKey, Activity activity) {
        return process(TurnRequest.builder().conversationKey(conversationKey).activity(activity).build());
    }

    /**
     * Forgets everything stored for the conversation.
     */
    void reset(String conversationKey);
}
