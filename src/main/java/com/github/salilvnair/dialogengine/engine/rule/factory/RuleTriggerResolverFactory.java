package com.github.salilvnair.dialogengine.engine.rule.factory;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.rule.TriggerType;
import com.github.salilvnair.dialogengine.engine.rule.core.RuleTriggerResolver;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class RuleTriggerResolverFactory {

    private final Map<TriggerType, RuleTriggerResolver> resolvers = new EnumMap<>(TriggerType.class);

    public RuleTriggerResolverFactory(List<RuleTriggerResolver> resolvers) {
        resolvers.forEach(resolver -> this.resolvers.put(resolver.type(), resolver));
    }

    public RuleTriggerResolver get(TriggerType type) {
        RuleTriggerResolver resolver = type == null ? null : resolvers.get(type);
        if (resolver == null) {
            throw new DialogEngineException(DialogEngineErrorCode.MISSING_TRIGGER_RESOLVER,
                    "No RuleTriggerResolver registered for trigger type " + type);
        }
        return resolver;
    }
}
