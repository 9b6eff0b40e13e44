package com.github.salilvnair.dialogengine.engine.step;

import java.util.List;
import java.util.Map;

/**
 * Edits the remainder of the step list the step itself runs in.
 */
public record EditSteps(ChangeType changeType, List<DialogStep> steps) implements DialogStep {

    public static final String STEPS_BRANCH = "steps";

    public enum ChangeType {
        /** Discard the remainder and run {@code steps} instead. */
        REPLACE_SEQUENCE,
        /** Run {@code steps} before the remainder. */
        INSERT_STEPS,
        /** Run {@code steps} after the remainder. */
        APPEND_STEPS,
        /** Discard the remainder. */
        END_SEQUENCE
    }

    public EditSteps {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static EditSteps of(ChangeType changeType, List<DialogStep> steps) {
        return new EditSteps(changeType, steps);
    }

    @Override
    public StepKind kind() {
        return StepKind.EDIT_STEPS;
    }

    @Override
    public Map<String, List<DialogStep>> branches() {
        return Map.of(STEPS_BRANCH, steps);
    }
}
