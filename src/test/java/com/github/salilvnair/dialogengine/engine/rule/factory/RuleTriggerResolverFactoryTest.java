package com.github.salilvnair.dialogengine.engine.rule.factory;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.rule.TriggerType;
import com.github.salilvnair.dialogengine.engine.rule.provider.IntentTriggerResolver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleTriggerResolverFactoryTest {

    private final RuleTriggerResolverFactory factory = new RuleTriggerResolverFactory(List.of(new IntentTriggerResolver()));

    @Test
    void returnsResolverForRegisteredType() {
        assertEquals(TriggerType.INTENT, factory.get(TriggerType.INTENT).type());
    }

    @Test
    void throwsForUnregisteredType() {
        DialogEngineException error = assertThrows(DialogEngineException.class, () -> factory.get(TriggerType.EVENT));

        assertTrue(error.is(DialogEngineErrorCode.MISSING_TRIGGER_RESOLVER));
    }
}
