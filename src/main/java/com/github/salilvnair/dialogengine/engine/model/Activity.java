package com.github.salilvnair.dialogengine.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound or outbound activity. {@code channelData} belongs to the transport and is
 * carried through untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Activity {

    private ActivityType type;
    private String text;
    private String locale;
    private String name;
    private Object value;
    private String valueType;
    private Map<String, Object> channelData;

    public static Activity message(String text) {
        return Activity.builder().type(ActivityType.MESSAGE).text(text).build();
    }

    public static Activity event(String name, Object value) {
        return Activity.builder().type(ActivityType.EVENT).name(name).value(value).build();
    }

    public static Activity conversationUpdate() {
        return Activity.builder().type(ActivityType.CONVERSATION_UPDATE).build();
    }

    public static Activity trace(String name, String valueType, Object value) {
        return Activity.builder().type(ActivityType.TRACE).name(name).valueType(valueType).value(value).build();
    }

    public boolean isMessage() {
        return type == ActivityType.MESSAGE;
    }

    /** Shape exposed to expressions as {@code turn.activity}. */
    public Map<String, Object> toMemoryValue() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("type", type == null ? null : type.name().toLowerCase());
        view.put("text", text);
        view.put("locale", locale);
        view.put("name", name);
        view.put("value", value);
        return view;
    }
}
