package com.github.salilvnair.dialogengine.transport;

import com.github.salilvnair.dialogengine.engine.model.Activity;

/**
 * Outbound side of the channel. Failures propagate to the caller of the turn;
 * retrying is the implementation's business.
 */
public interface ActivitySender {

    void send(String conversationKey, Activity activity);
}
