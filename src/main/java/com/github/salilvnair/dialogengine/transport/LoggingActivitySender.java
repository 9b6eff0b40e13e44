package com.github.salilvnair.dialogengine.transport;

import com.github.salilvnair.dialogengine.engine.model.Activity;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingActivitySender implements ActivitySender {

    @Override
    public void send(String conversationKey, Activity activity) {
        log.info("[{}] -> {} {}", conversationKey, activity.getType(),
                activity.getText() != null ? activity.getText() : activity.getName());
    }
}
