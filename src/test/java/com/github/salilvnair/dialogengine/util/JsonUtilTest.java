package com.github.salilvnair.dialogengine.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

class JsonUtilTest {

    @Test
    @SuppressWarnings("unchecked")
    void deepCopyDetachesNestedContainers() {
        Map<String, Object> original = new LinkedHashMap<>();
        original.put("items", new ArrayList<>(List.of(1, 2)));

        Map<String, Object> copy = JsonUtil.deepCopy(original);
        ((List<Object>) copy.get("items")).add(3);

        assertEquals(List.of(1, 2), original.get("items"));
        assertNotSame(original, copy);
    }

    @Test
    void deepCopyMakesImmutableCollectionsMutable() {
        List<String> copy = JsonUtil.deepCopy(List.of("a"));

        assertInstanceOf(ArrayList.class, copy);
        copy.add("b");
        assertEquals(List.of("a", "b"), copy);
    }

    @Test
    void deepCopyReturnsScalarsAsIs() {
        String value = "text";

        assertSame(value, JsonUtil.deepCopy(value));
    }

    @Test
    void toJsonAndFromJsonRoundTripMaps() {
        String json = JsonUtil.toJson(Map.of("name", "Carlos"));

        assertEquals("{\"name\":\"Carlos\"}", json);
        assertEquals(Map.of("name", "Carlos"), JsonUtil.fromJson(json, Map.class));
    }
}
