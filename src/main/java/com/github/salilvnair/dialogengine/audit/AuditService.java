package com.github.salilvnair.dialogengine.audit;

import com.github.salilvnair.dialogengine.util.JsonUtil;

import java.util.Map;

public interface AuditService {

    void audit(String stage, String conversationKey, String payloadJson);

    default void audit(DialogAuditStage stage, String conversationKey, String payloadJson) {
        audit(stage.value(), conversationKey, payloadJson);
    }

    default void audit(String stage, String conversationKey, Map<String, ?> payload) {
        audit(stage, conversationKey, JsonUtil.toJson(payload == null ? Map.of() : payload));
    }

    default void audit(DialogAuditStage stage, String conversationKey, Map<String, ?> payload) {
        audit(stage.value(), conversationKey, payload);
    }
}
