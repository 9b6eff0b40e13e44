package com.github.salilvnair.dialogengine.engine.dialog;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One level of the hierarchical step cursor: the steps still to run in a list,
 * the loop driving the list (if any) and the step-local {@code this} scope.
 */
@Data
@NoArgsConstructor
public class StepFrame {

    private List<StepRef> pending = new ArrayList<>();
    private Map<String, Object> locals = new LinkedHashMap<>();
    private LoopState loop;
    /** Rule steps an ancestor runs on behalf of the top of the stack. */
    private boolean interruption;

    public static StepFrame sequence(List<StepRef> refs) {
        StepFrame frame = new StepFrame();
        frame.pending.addAll(refs);
        return frame;
    }

    public static StepFrame loop(List<StepRef> body, LoopState loop) {
        StepFrame frame = sequence(body);
        frame.loop = loop;
        return frame;
    }

    public static StepFrame interruption(List<StepRef> refs) {
        StepFrame frame = sequence(refs);
        frame.interruption = true;
        return frame;
    }

    public boolean exhausted() {
        return pending.isEmpty();
    }

    public StepRef head() {
        return pending.isEmpty() ? null : pending.get(0);
    }

    public StepRef advance() {
        return pending.remove(0);
    }

    public void pushFront(StepRef ref) {
        pending.add(0, ref);
    }

    public void insertFront(List<StepRef> refs) {
        pending.addAll(0, refs);
    }

    public void append(List<StepRef> refs) {
        pending.addAll(refs);
    }

    public void replacePending(List<StepRef> refs) {
        pending.clear();
        pending.addAll(refs);
    }
}
