package com.github.salilvnair.dialogengine.engine.memory;

import com.github.salilvnair.dialogengine.engine.dialog.DialogInstance;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialogMemoryTest {

    private DialogMemory memory;

    @BeforeEach
    void setUp() {
        memory = new DialogMemory(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    @Test
    void setCreatesIntermediateMaps() {
        memory.set("user.profile.age", 30);

        assertEquals(30, memory.get("user.profile.age"));
        assertEquals(Map.of("age", 30), memory.getUserState().get("profile"));
    }

    @Test
    void setPadsListsUpToIndex() {
        memory.set("conversation.items[2]", "c");

        assertEquals(Arrays.asList(null, null, "c"), memory.get("conversation.items"));
    }

    @Test
    void farOutOfRangeListIndexIsRejected() {
        memory.set("user.items[0]", "a");

        DialogEngineException error = assertThrows(DialogEngineException.class,
                () -> memory.set("user.items[2000000000]", "z"));

        assertTrue(error.is(DialogEngineErrorCode.MEMORY_WRITE_FAILED));
        assertEquals(List.of("a"), memory.get("user.items"));
    }

    @Test
    void missingPathReadsAsNull() {
        assertNull(memory.get("user.address.city"));
        assertNull(memory.get("turn.items[3]"));
    }

    @Test
    void writingThroughScalarFails() {
        memory.set("user.name", "Ann");

        DialogEngineException error = assertThrows(DialogEngineException.class, () -> memory.set("user.name.first", "A"));

        assertTrue(error.is(DialogEngineErrorCode.MEMORY_WRITE_FAILED));
    }

    @Test
    void wholeScopeCannotBeOverwritten() {
        DialogEngineException error = assertThrows(DialogEngineException.class, () -> memory.set("user", Map.of()));

        assertTrue(error.is(DialogEngineErrorCode.INVALID_MEMORY_PATH));
    }

    @Test
    void deleteRemovesKeysAndReportsWhetherAnythingChanged() {
        memory.set("user.name", "Ann");
        memory.set("turn.flag", true);

        assertTrue(memory.delete("user.name"));
        assertFalse(memory.delete("user.name"));
        assertTrue(memory.delete("turn"));
        assertTrue(memory.getTurnState().isEmpty());
    }

    @Test
    void dialogScopeFollowsBoundInstance() {
        DialogInstance first = DialogInstance.create("first", null);
        DialogInstance second = DialogInstance.create("second", null);

        memory.bind(first);
        memory.set("dialog.count", 1);
        memory.bind(second);
        assertNull(memory.get("dialog.count"));
        memory.bind(first);

        assertEquals(1, memory.get("dialog.count"));
        assertEquals(1, first.getState().get("count"));
    }

    @Test
    void thisScopeLivesOnTopFrame() {
        DialogInstance instance = DialogInstance.create("first", null);
        instance.pushFrame(StepFrame.sequence(List.of()));
        memory.bind(instance);

        memory.set("this.tmp", "x");
        assertEquals("x", instance.topFrame().getLocals().get("tmp"));

        instance.popFrame();
        assertNull(memory.get("this.tmp"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void snapshotIsDetachedFromLiveState() {
        memory.set("user.name", "Ann");

        Map<String, Object> snapshot = memory.snapshot();
        memory.set("user.name", "Bob");

        assertEquals("Ann", ((Map<String, Object>) snapshot.get("user")).get("name"));
        assertTrue(snapshot.keySet().containsAll(List.of("user", "conversation", "dialog", "turn", "this")));
    }
}
