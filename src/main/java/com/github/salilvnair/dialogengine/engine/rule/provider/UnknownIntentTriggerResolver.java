package com.github.salilvnair.dialogengine.engine.rule.provider;

import com.github.salilvnair.dialogengine.engine.constants.DialogEvents;
import com.github.salilvnair.dialogengine.engine.model.DialogEvent;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.rule.TriggerType;
import com.github.salilvnair.dialogengine.engine.rule.core.RuleTriggerResolver;
import org.springframework.stereotype.Component;

@Component
public class UnknownIntentTriggerResolver implements RuleTriggerResolver {

    @Override
    public TriggerType type() {
        return TriggerType.UNKNOWN_INTENT;
    }

    @Override
    public boolean matches(DialogEvent event, DialogRule rule) {
        return event.named(DialogEvents.UNKNOWN_INTENT);
    }

    @Override
    public int specificity(DialogRule rule) {
        return 0;
    }
}
