package com.github.salilvnair.dialogengine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

@UtilityClass
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Convert any object into JSON string.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize object to JSON", e);
        }
    }

    /**
     * Parse JSON string into target type.
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to deserialize JSON", e);
        }
    }

    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    /** Plain java view of a tree node: maps, lists, strings, numbers, booleans or null. */
    public static Object toPlain(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return MAPPER.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to convert JSON node", e);
        }
    }

    /**
     * Deep copy through the JSON tree. Maps and collections come back as mutable
     * {@link LinkedHashMap} / {@link ArrayList}, other values keep their class.
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T value) {
        if (value == null || value instanceof String || value instanceof Number
                || value instanceof Boolean || value instanceof Enum<?>) {
            return value;
        }
        Class<?> target;
        if (value instanceof Map<?, ?>) {
            target = LinkedHashMap.class;
        }
        else if (value instanceof Collection<?>) {
            target = ArrayList.class;
        }
        else {
            target = value.getClass();
        }
        try {
            return (T) MAPPER.treeToValue(MAPPER.valueToTree(value), target);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to copy value of type " + value.getClass().getName(), e);
        }
    }
}
