package com.github.salilvnair.dialogengine.engine.memory;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryPathTest {

    @Test
    void parsesKeysIndexesAndQuotedKeys() {
        MemoryPath path = MemoryPath.parse("user.profile.items[0]['first name']");

        assertEquals(MemoryScope.USER, path.scope());
        assertEquals(4, path.segments().size());
        assertEquals("profile", path.segments().get(0).key());
        assertEquals("items", path.segments().get(1).key());
        assertTrue(path.segments().get(2).isIndex());
        assertEquals(0, path.segments().get(2).index());
        assertEquals("first name", path.last().key());
    }

    @Test
    void scopePrefixIgnoresCase() {
        assertEquals(MemoryScope.CONVERSATION, MemoryPath.parse("Conversation.topic").scope());
    }

    @Test
    void bareScopeIsScopeRoot() {
        assertTrue(MemoryPath.parse("dialog").isScopeRoot());
    }

    @Test
    void unknownScopeIsRejected() {
        DialogEngineException error = assertThrows(DialogEngineException.class, () -> MemoryPath.parse("session.id"));

        assertTrue(error.is(DialogEngineErrorCode.UNKNOWN_MEMORY_SCOPE));
    }

    @Test
    void malformedPathsAreRejected() {
        for (String path : new String[]{" ", "user..name", "user.", "user.items[0", "user.items[abc]", "user.items[-1]", "[0].x"}) {
            DialogEngineException error = assertThrows(DialogEngineException.class, () -> MemoryPath.parse(path), path);
            assertTrue(error.is(DialogEngineErrorCode.INVALID_MEMORY_PATH), path);
        }
    }
}
