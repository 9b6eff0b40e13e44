package com.github.salilvnair.dialogengine.engine.dialog;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A dialog definition instantiated on the stack. {@code state} is the instance's
 * private {@code dialog} scope; {@code frames} is its step cursor, innermost last.
 */
@Data
@NoArgsConstructor
public class DialogInstance {

    private String instanceId;
    private String dialogId;
    private Map<String, Object> state = new LinkedHashMap<>();
    private List<StepFrame> frames = new ArrayList<>();
    private String resultProperty;
    private InputState pendingInput;

    public static DialogInstance create(String dialogId, String resultProperty) {
        DialogInstance instance = new DialogInstance();
        instance.instanceId = UUID.randomUUID().toString();
        instance.dialogId = dialogId;
        instance.resultProperty = resultProperty;
        return instance;
    }

    public StepFrame topFrame() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public void pushFrame(StepFrame frame) {
        frames.add(frame);
    }

    public StepFrame popFrame() {
        return frames.remove(frames.size() - 1);
    }

    public boolean hasPendingSteps() {
        return frames.stream().anyMatch(frame -> !frame.exhausted() || frame.getLoop() != null);
    }

    /**
     * Splices rule steps in front of whatever the cursor would run next. An ancestor
     * runs them in a frame of their own, so its parked steps stay parked.
     */
    public void queueSteps(List<StepRef> refs, boolean interruption) {
        if (interruption) {
            pushFrame(StepFrame.interruption(refs));
            return;
        }
        StepFrame top = topFrame();
        if (top == null) {
            pushFrame(StepFrame.sequence(refs));
            return;
        }
        top.insertFront(refs);
    }

    public void resetCursor() {
        frames.clear();
        pendingInput = null;
    }
}
