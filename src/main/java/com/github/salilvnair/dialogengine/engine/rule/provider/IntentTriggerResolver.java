package com.github.salilvnair.dialogengine.engine.rule.provider;

import com.github.salilvnair.dialogengine.engine.constants.DialogEvents;
import com.github.salilvnair.dialogengine.engine.model.DialogEvent;
import com.github.salilvnair.dialogengine.engine.model.RecognizerResult;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.rule.TriggerType;
import com.github.salilvnair.dialogengine.engine.rule.core.RuleTriggerResolver;
import org.springframework.stereotype.Component;

@Component
public class IntentTriggerResolver implements RuleTriggerResolver {

    @Override
    public TriggerType type() {
        return TriggerType.INTENT;
    }

    @Override
    public boolean matches(DialogEvent event, DialogRule rule) {
        if (!event.named(DialogEvents.RECOGNIZED_INTENT)
                || !(event.getValue() instanceof RecognizerResult result)
                || result.intent() == null) {
            return false;
        }
        return rule.names().stream().anyMatch(name -> name.equalsIgnoreCase(result.intent()));
    }

    @Override
    public int specificity(DialogRule rule) {
        return 1;
    }
}
