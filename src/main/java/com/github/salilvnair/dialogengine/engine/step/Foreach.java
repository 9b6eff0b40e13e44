package com.github.salilvnair.dialogengine.engine.step;

import com.github.salilvnair.dialogengine.engine.constants.MemoryKeys;

import java.util.List;
import java.util.Map;

public record Foreach(String listProperty, String indexProperty, String valueProperty, List<DialogStep> steps)
        implements DialogStep {

    public static final String BODY_BRANCH = "body";

    public Foreach {
        indexProperty = indexProperty == null ? MemoryKeys.DIALOG_INDEX : indexProperty;
        valueProperty = valueProperty == null ? MemoryKeys.DIALOG_VALUE : valueProperty;
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Foreach of(String listProperty, List<DialogStep> steps) {
        return new Foreach(listProperty, null, null, steps);
    }

    @Override
    public StepKind kind() {
        return StepKind.FOREACH;
    }

    @Override
    public Map<String, List<DialogStep>> branches() {
        return Map.of(BODY_BRANCH, steps);
    }
}
