package com.github.salilvnair.dialogengine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.model.ConversationSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps snapshots as JSON so callers always work on a private copy.
 */
@Slf4j
public class InMemoryDialogStateStore implements DialogStateStore {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;

    public InMemoryDialogStateStore(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<ConversationSnapshot> load(String conversationKey) {
        String json = snapshots.get(conversationKey);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(json, ConversationSnapshot.class));
        } catch (JsonProcessingException e) {
            throw new DialogEngineException(DialogEngineErrorCode.STATE_LOAD_FAILED,
                    "Failed to read snapshot for conversation " + conversationKey, e);
        }
    }

    @Override
    public void save(String conversationKey, ConversationSnapshot snapshot) {
        try {
            snapshots.put(conversationKey, mapper.writeValueAsString(snapshot));
            log.debug("Saved snapshot for conversation {} (stack depth {})",
                    conversationKey, snapshot.getStack().depth());
        } catch (JsonProcessingException e) {
            throw new DialogEngineException(DialogEngineErrorCode.STATE_SAVE_FAILED,
                    "Failed to write snapshot for conversation " + conversationKey, e);
        }
    }

    @Override
    public void delete(String conversationKey) {
        snapshots.remove(conversationKey);
    }
}
