package com.github.salilvnair.dialogengine.engine.memory;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed form of a memory path such as {@code user.profile.items[0]['first name']}.
 */
public record MemoryPath(String raw, MemoryScope scope, List<Segment> segments) {

    public record Segment(String key, Integer index) {

        static Segment key(String key) {
            return new Segment(key, null);
        }

        static Segment index(int index) {
            return new Segment(null, index);
        }

        public boolean isIndex() {
            return index != null;
        }

        @Override
        public String toString() {
            return isIndex() ? "[" + index + "]" : key;
        }
    }

    public static MemoryPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw invalid(path, "Memory path is blank");
        }
        String trimmed = path.trim();
        List<Segment> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < trimmed.length()) {
            char c = trimmed.charAt(i);
            if (c == '.') {
                if (current.length() == 0 && (segments.isEmpty() || trimmed.charAt(i - 1) != ']')) {
                    throw invalid(path, "Empty segment in memory path: " + path);
                }
                flush(current, segments);
                i++;
                continue;
            }
            if (c == '[') {
                flush(current, segments);
                int close = trimmed.indexOf(']', i);
                if (close < 0) {
                    throw invalid(path, "Unclosed index in memory path: " + path);
                }
                segments.add(bracketSegment(path, trimmed.substring(i + 1, close).trim()));
                i = close + 1;
                continue;
            }
            current.append(c);
            i++;
        }
        if (current.length() == 0 && trimmed.endsWith(".")) {
            throw invalid(path, "Empty segment in memory path: " + path);
        }
        flush(current, segments);
        if (segments.isEmpty() || segments.get(0).isIndex()) {
            throw invalid(path, "Memory path must start with a scope: " + path);
        }
        String prefix = segments.get(0).key();
        MemoryScope scope = MemoryScope.fromPrefix(prefix)
                .orElseThrow(() -> new DialogEngineException(
                        DialogEngineErrorCode.UNKNOWN_MEMORY_SCOPE,
                        "Unknown memory scope '" + prefix + "' in path: " + path));
        return new MemoryPath(trimmed, scope, List.copyOf(segments.subList(1, segments.size())));
    }

    public boolean isScopeRoot() {
        return segments.isEmpty();
    }

    public Segment last() {
        return segments.get(segments.size() - 1);
    }

    private static Segment bracketSegment(String path, String inner) {
        if (inner.isEmpty()) {
            throw invalid(path, "Empty index in memory path: " + path);
        }
        char first = inner.charAt(0);
        if ((first == '\'' || first == '"') && inner.length() >= 2 && inner.charAt(inner.length() - 1) == first) {
            return Segment.key(inner.substring(1, inner.length() - 1));
        }
        try {
            int index = Integer.parseInt(inner);
            if (index < 0) {
                throw invalid(path, "Negative index in memory path: " + path);
            }
            return Segment.index(index);
        } catch (NumberFormatException e) {
            throw invalid(path, "Index must be an integer or a quoted key: " + path);
        }
    }

    private static void flush(StringBuilder current, List<Segment> segments) {
        if (current.length() > 0) {
            segments.add(Segment.key(current.toString().trim()));
            current.setLength(0);
        }
    }

    private static DialogEngineException invalid(String path, String message) {
        return new DialogEngineException(DialogEngineErrorCode.INVALID_MEMORY_PATH, message);
    }
}
