package com.github.salilvnair.dialogengine.engine.memory;

import com.github.salilvnair.dialogengine.engine.dialog.DialogInstance;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.util.JsonUtil;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layered memory of one turn. Resolves paths against the {@code user},
 * {@code conversation}, {@code turn}, {@code dialog} and {@code this} scopes, the
 * last two following whichever dialog instance is currently bound.
 */
public class DialogMemory {

    /** Most {@code null} slots a write may add in front of a new list element. */
    static final int MAX_LIST_PADDING = 10_000;

    @Getter
    private final Map<String, Object> userState;
    @Getter
    private final Map<String, Object> conversationState;
    @Getter
    private final Map<String, Object> turnState;

    private final Map<String, Object> detachedDialogState = new LinkedHashMap<>();
    private final Map<String, Object> detachedLocals = new LinkedHashMap<>();

    private DialogInstance boundInstance;

    public DialogMemory(Map<String, Object> userState,
                        Map<String, Object> conversationState,
                        Map<String, Object> turnState) {
        this.userState = userState;
        this.conversationState = conversationState;
        this.turnState = turnState;
    }

    public void bind(DialogInstance instance) {
        this.boundInstance = instance;
    }

    public Map<String, Object> scope(MemoryScope scope) {
        return switch (scope) {
            case USER -> userState;
            case CONVERSATION -> conversationState;
            case TURN -> turnState;
            case DIALOG -> boundInstance == null ? detachedDialogState : boundInstance.getState();
            case THIS -> {
                StepFrame frame = boundInstance == null ? null : boundInstance.topFrame();
                yield frame == null ? detachedLocals : frame.getLocals();
            }
        };
    }

    /**
     * Live view of every scope keyed by its prefix, as seen by expressions and templates.
     */
    public Map<String, Object> scopes() {
        Map<String, Object> scopes = new LinkedHashMap<>();
        for (MemoryScope scope : MemoryScope.values()) {
            scopes.put(scope.prefix(), scope(scope));
        }
        return scopes;
    }

    public Map<String, Object> snapshot() {
        return JsonUtil.deepCopy(scopes());
    }

    public Object get(String path) {
        return get(MemoryPath.parse(path));
    }

    public Object get(MemoryPath path) {
        Object current = scope(path.scope());
        for (MemoryPath.Segment segment : path.segments()) {
            current = child(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public void set(String path, Object value) {
        set(MemoryPath.parse(path), value);
    }

    public void set(MemoryPath path, Object value) {
        if (path.isScopeRoot()) {
            throw new DialogEngineException(DialogEngineErrorCode.INVALID_MEMORY_PATH,
                    "Cannot overwrite a whole memory scope: " + path.raw());
        }
        Object parent = scope(path.scope());
        List<MemoryPath.Segment> segments = path.segments();
        for (int i = 0; i < segments.size() - 1; i++) {
            MemoryPath.Segment segment = segments.get(i);
            Object next = child(parent, segment);
            if (next == null) {
                next = segments.get(i + 1).isIndex() ? new ArrayList<>() : new LinkedHashMap<String, Object>();
                assign(parent, segment, next, path);
            }
            else if (!(next instanceof Map<?, ?>) && !(next instanceof List<?>)) {
                throw new DialogEngineException(DialogEngineErrorCode.MEMORY_WRITE_FAILED,
                        "Cannot write through scalar value at '" + segment + "' of " + path.raw());
            }
            parent = next;
        }
        assign(parent, path.last(), value, path);
    }

    public boolean delete(String path) {
        MemoryPath parsed = MemoryPath.parse(path);
        if (parsed.isScopeRoot()) {
            Map<String, Object> scope = scope(parsed.scope());
            boolean hadValues = !scope.isEmpty();
            scope.clear();
            return hadValues;
        }
        Object parent = scope(parsed.scope());
        List<MemoryPath.Segment> segments = parsed.segments();
        for (int i = 0; i < segments.size() - 1; i++) {
            parent = child(parent, segments.get(i));
            if (parent == null) {
                return false;
            }
        }
        MemoryPath.Segment last = parsed.last();
        if (parent instanceof Map<?, ?> map) {
            String key = last.isIndex() ? String.valueOf(last.index()) : last.key();
            if (!map.containsKey(key)) {
                return false;
            }
            map.remove(key);
            return true;
        }
        if (parent instanceof List<?> list) {
            Integer index = indexOf(last);
            if (index == null || index >= list.size()) {
                return false;
            }
            list.remove(index.intValue());
            return true;
        }
        return false;
    }

    private Object child(Object container, MemoryPath.Segment segment) {
        if (container instanceof Map<?, ?> map) {
            return map.get(segment.isIndex() ? String.valueOf(segment.index()) : segment.key());
        }
        if (container instanceof List<?> list) {
            Integer index = indexOf(segment);
            return index == null || index >= list.size() ? null : list.get(index);
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private void assign(Object container, MemoryPath.Segment segment, Object value, MemoryPath path) {
        try {
            if (container instanceof Map<?, ?> map) {
                ((Map<String, Object>) map).put(segment.isIndex() ? String.valueOf(segment.index()) : segment.key(), value);
                return;
            }
            if (container instanceof List<?> raw) {
                Integer index = indexOf(segment);
                if (index == null) {
                    throw new DialogEngineException(DialogEngineErrorCode.MEMORY_WRITE_FAILED,
                            "List element must be addressed by index in " + path.raw());
                }
                List<Object> list = (List<Object>) raw;
                if (index < list.size()) {
                    list.set(index, value);
                }
                else {
                    if (index - list.size() > MAX_LIST_PADDING) {
                        throw new DialogEngineException(DialogEngineErrorCode.MEMORY_WRITE_FAILED,
                                "Index " + index + " is too far past the end of the list (size " + list.size() + ") in " + path.raw());
                    }
                    list.addAll(Collections.nCopies(index - list.size(), null));
                    list.add(value);
                }
                return;
            }
        } catch (UnsupportedOperationException e) {
            throw new DialogEngineException(DialogEngineErrorCode.MEMORY_WRITE_FAILED,
                    "Container at " + path.raw() + " is read-only", e);
        }
        throw new DialogEngineException(DialogEngineErrorCode.MEMORY_WRITE_FAILED,
                "Cannot write into a scalar value at " + path.raw());
    }

    private Integer indexOf(MemoryPath.Segment segment) {
        if (segment.isIndex()) {
            return segment.index();
        }
        try {
            int index = Integer.parseInt(segment.key());
            return index < 0 ? null : index;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
