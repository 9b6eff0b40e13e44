package com.github.salilvnair.dialogengine.engine.rule.provider;

import com.github.salilvnair.dialogengine.engine.model.DialogEvent;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.rule.TriggerType;
import com.github.salilvnair.dialogengine.engine.rule.core.RuleTriggerResolver;
import org.springframework.stereotype.Component;

@Component
public class EventTriggerResolver implements RuleTriggerResolver {

    @Override
    public TriggerType type() {
        return TriggerType.EVENT;
    }

    @Override
    public boolean matches(DialogEvent event, DialogRule rule) {
        return rule.names().stream().anyMatch(event::named);
    }

    @Override
    public int specificity(DialogRule rule) {
        return 1;
    }
}
