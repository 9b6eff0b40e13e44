package com.github.salilvnair.dialogengine.engine.step;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates {@code condition} and runs the first case whose literal value equals the
 * result, or {@code defaultSteps} when none does.
 */
public record SwitchCondition(String condition, List<Case> cases, List<DialogStep> defaultSteps) implements DialogStep {

    public static final String DEFAULT_BRANCH = "default";

    public record Case(String value, List<DialogStep> steps) {

        public Case {
            steps = steps == null ? List.of() : List.copyOf(steps);
        }

        public static Case of(String value, List<DialogStep> steps) {
            return new Case(value, steps);
        }
    }

    public SwitchCondition {
        cases = cases == null ? List.of() : List.copyOf(cases);
        defaultSteps = defaultSteps == null ? List.of() : List.copyOf(defaultSteps);
    }

    public static SwitchCondition of(String condition, List<Case> cases, List<DialogStep> defaultSteps) {
        return new SwitchCondition(condition, cases, defaultSteps);
    }

    public static String caseBranch(int index) {
        return "case[" + index + "]";
    }

    @Override
    public StepKind kind() {
        return StepKind.SWITCH_CONDITION;
    }

    @Override
    public Map<String, List<DialogStep>> branches() {
        Map<String, List<DialogStep>> branches = new LinkedHashMap<>();
        for (int i = 0; i < cases.size(); i++) {
            branches.put(caseBranch(i), cases.get(i).steps());
        }
        branches.put(DEFAULT_BRANCH, defaultSteps);
        return branches;
    }
}
