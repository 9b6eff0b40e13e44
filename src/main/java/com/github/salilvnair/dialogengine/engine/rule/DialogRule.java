package com.github.salilvnair.dialogengine.engine.rule;

import com.github.salilvnair.dialogengine.engine.step.DialogStep;

import java.util.List;

/**
 * Trigger plus optional condition, priority and the steps to run when selected.
 * Higher priority wins.
 */
public record DialogRule(
        TriggerType triggerType,
        List<String> names,
        String condition,
        int priority,
        List<DialogStep> steps
) {

    public DialogRule {
        names = names == null ? List.of() : List.copyOf(names);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static DialogRule intent(String intent, List<DialogStep> steps) {
        return new DialogRule(TriggerType.INTENT, List.of(intent), null, 0, steps);
    }

    public static DialogRule event(String eventName, List<DialogStep> steps) {
        return new DialogRule(TriggerType.EVENT, List.of(eventName), null, 0, steps);
    }

    public static DialogRule unknownIntent(List<DialogStep> steps) {
        return new DialogRule(TriggerType.UNKNOWN_INTENT, List.of(), null, 0, steps);
    }

    public DialogRule withCondition(String condition) {
        return new DialogRule(triggerType, names, condition, priority, steps);
    }

    public DialogRule withPriority(int priority) {
        return new DialogRule(triggerType, names, condition, priority, steps);
    }
}
