package com.github.salilvnair.dialogengine.engine.rule.core;

import com.github.salilvnair.dialogengine.engine.model.DialogEvent;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.rule.TriggerType;

public interface RuleTriggerResolver {

    TriggerType type();

    boolean matches(DialogEvent event, DialogRule rule);

    /**
     * Rules naming a concrete intent or event outrank catch-alls of equal priority.
     */
    int specificity(DialogRule rule);
}
