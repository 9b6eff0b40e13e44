package com.github.salilvnair.dialogengine.engine.step;

import com.github.salilvnair.dialogengine.engine.constants.MemoryKeys;

import java.util.List;
import java.util.Map;

public record ForeachPage(String listProperty, int pageSize, String valueProperty, List<DialogStep> steps)
        implements DialogStep {

    public static final String BODY_BRANCH = "body";

    public ForeachPage {
        valueProperty = valueProperty == null ? MemoryKeys.DIALOG_PAGE : valueProperty;
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static ForeachPage of(String listProperty, int pageSize, List<DialogStep> steps) {
        return new ForeachPage(listProperty, pageSize, null, steps);
    }

    @Override
    public StepKind kind() {
        return StepKind.FOREACH_PAGE;
    }

    @Override
    public Map<String, List<DialogStep>> branches() {
        return Map.of(BODY_BRANCH, steps);
    }
}
