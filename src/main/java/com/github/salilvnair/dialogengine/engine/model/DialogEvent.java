package com.github.salilvnair.dialogengine.engine.model;

import com.github.salilvnair.dialogengine.engine.constants.DialogEvents;
import com.github.salilvnair.dialogengine.util.JsonUtil;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@ToString
public final class DialogEvent {

    private final String name;
    private final Object value;
    private final boolean bubble;

    public DialogEvent(String name, Object value, boolean bubble) {
        this.name = name;
        this.value = value;
        this.bubble = bubble;
    }

    public static DialogEvent of(String name, Object value, boolean bubble) {
        return new DialogEvent(name, value, bubble);
    }

    public static DialogEvent recognizedIntent(RecognizerResult result) {
        return new DialogEvent(DialogEvents.RECOGNIZED_INTENT, result, true);
    }

    public static DialogEvent unknownIntent(RecognizerResult result) {
        return new DialogEvent(DialogEvents.UNKNOWN_INTENT, result, true);
    }

    public boolean named(String eventName) {
        return name != null && name.equals(eventName);
    }

    /** Hop copy for bubbling; the payload is deep copied so no two frames share it. */
    public DialogEvent copy() {
        return new DialogEvent(name, JsonUtil.deepCopy(value), bubble);
    }

    public Map<String, Object> toMemoryValue() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", name);
        view.put("value", value instanceof RecognizerResult result ? result.toMemoryValue() : value);
        view.put("bubble", bubble);
        return view;
    }
}
