package com.github.salilvnair.dialogengine.audit;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingAuditService implements AuditService {

    @Override
    public void audit(String stage, String conversationKey, String payloadJson) {
        if (log.isDebugEnabled()) {
            log.debug("[{}] {} {}", conversationKey, stage, payloadJson);
        }
    }
}
