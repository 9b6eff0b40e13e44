package com.github.salilvnair.dialogengine.engine.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record RecognizerResult(String text, String intent, double score, Map<String, Object> entities) {

    public RecognizerResult {
        entities = entities == null ? Map.of() : Map.copyOf(entities);
    }

    public static RecognizerResult none(String text) {
        return new RecognizerResult(text, null, 0.0d, Map.of());
    }

    public Map<String, Object> toMemoryValue() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("text", text);
        view.put("intent", intent);
        view.put("score", score);
        view.put("entities", entities);
        return view;
    }
}
