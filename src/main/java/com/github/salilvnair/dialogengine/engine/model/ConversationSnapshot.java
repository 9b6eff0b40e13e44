package com.github.salilvnair.dialogengine.engine.model;

import com.github.salilvnair.dialogengine.engine.dialog.DialogStack;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything persisted for a conversation between turns.
 */
@Data
@NoArgsConstructor
public class ConversationSnapshot {
    private DialogStack stack = new DialogStack();
    private Map<String, Object> userState = new LinkedHashMap<>();
    private Map<String, Object> conversationState = new LinkedHashMap<>();
}
