package com.github.salilvnair.dialogengine.engine.step;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record IfCondition(String condition, List<DialogStep> steps, List<DialogStep> elseSteps) implements DialogStep {

    public static final String THEN_BRANCH = "then";
    public static final String ELSE_BRANCH = "else";

    public IfCondition {
        steps = steps == null ? List.of() : List.copyOf(steps);
        elseSteps = elseSteps == null ? List.of() : List.copyOf(elseSteps);
    }

    public static IfCondition of(String condition, List<DialogStep> steps) {
        return new IfCondition(condition, steps, List.of());
    }

    public static IfCondition of(String condition, List<DialogStep> steps, List<DialogStep> elseSteps) {
        return new IfCondition(condition, steps, elseSteps);
    }

    @Override
    public StepKind kind() {
        return StepKind.IF_CONDITION;
    }

    @Override
    public Map<String, List<DialogStep>> branches() {
        Map<String, List<DialogStep>> branches = new LinkedHashMap<>();
        branches.put(THEN_BRANCH, steps);
        branches.put(ELSE_BRANCH, elseSteps);
        return branches;
    }
}
