package com.github.salilvnair.dialogengine.engine.memory;

import java.util.Arrays;
import java.util.Optional;

public enum MemoryScope {

    USER("user", true),
    CONVERSATION("conversation", true),
    DIALOG("dialog", true),
    TURN("turn", false),
    THIS("this", false);

    private final String prefix;
    private final boolean persisted;

    MemoryScope(String prefix, boolean persisted) {
        this.prefix = prefix;
        this.persisted = persisted;
    }

    public String prefix() {
        return prefix;
    }

    public boolean persisted() {
        return persisted;
    }

    public static Optional<MemoryScope> fromPrefix(String prefix) {
        if (prefix == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(scope -> scope.prefix.equalsIgnoreCase(prefix.trim()))
                .findFirst();
    }
}
