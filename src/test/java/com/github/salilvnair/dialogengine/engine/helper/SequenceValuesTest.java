package com.github.salilvnair.dialogengine.engine.helper;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceValuesTest {

    @Test
    void asListAcceptsNullListsIterablesAndArrays() {
        assertTrue(SequenceValues.asList(null, "dialog.items").isEmpty());
        assertEquals(List.of(1, 2), SequenceValues.asList(List.of(1, 2), "dialog.items"));
        assertEquals(List.of("a", "b"), SequenceValues.asList(new LinkedHashSet<>(List.of("a", "b")), "dialog.items"));
        assertEquals(List.of(1, 2), SequenceValues.asList(new int[]{1, 2}, "dialog.items"));
    }

    @Test
    void asListRejectsScalars() {
        DialogEngineException error = assertThrows(DialogEngineException.class, () -> SequenceValues.asList("abc", "dialog.items"));

        assertTrue(error.is(DialogEngineErrorCode.NOT_A_SEQUENCE));
    }

    @Test
    void looselyEqualsComparesNumbersByValue() {
        assertTrue(SequenceValues.looselyEquals(1, 1.0d));
        assertTrue(SequenceValues.looselyEquals(7L, 7));
        assertFalse(SequenceValues.looselyEquals("1", 1));
    }

    @Test
    void matchesLiteralByValueType() {
        assertTrue(SequenceValues.matchesLiteral(22, "22.0"));
        assertTrue(SequenceValues.matchesLiteral(true, "True"));
        assertFalse(SequenceValues.matchesLiteral("frank", "Frank"));
        assertTrue(SequenceValues.matchesLiteral(null, "null"));
        assertFalse(SequenceValues.matchesLiteral(3, "three"));
    }
}
