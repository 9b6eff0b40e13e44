package com.github.salilvnair.dialogengine.service;

import com.github.salilvnair.dialogengine.engine.model.ConversationSnapshot;

import java.util.Optional;

/**
 * Whole-snapshot persistence per conversation key. Implementations must make
 * {@link #save} atomic per key; the engine never saves a partial turn.
 */
public interface DialogStateStore {

    Optional<ConversationSnapshot> load(String conversationKey);

    void save(String conversationKey, ConversationSnapshot snapshot);

    void delete(String conversationKey);
}
