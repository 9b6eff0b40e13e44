package com.github.salilvnair.dialogengine.engine.step.handler.factory;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.ForeachStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.SendOutputStepHandler;
import com.github.salilvnair.dialogengine.support.DialogEngineTestSupport;
import com.github.salilvnair.dialogengine.template.LanguageGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class StepHandlerFactoryTest {

    @Test
    void initRegistersOneHandlerPerKind() {
        StepHandlerFactory factory = new DialogEngineTestSupport().getStepHandlerFactory();

        for (StepKind kind : StepKind.values()) {
            assertEquals(kind, factory.get(kind).kind());
        }
        assertInstanceOf(ForeachStepHandler.class, factory.loopHandler(StepKind.FOREACH));
    }

    @Test
    void initRejectsDuplicateHandlers() {
        LanguageGenerator generator = mock(LanguageGenerator.class);
        StepHandlerFactory factory = new StepHandlerFactory(List.of(
                new SendOutputStepHandler(generator), new SendOutputStepHandler(generator)));

        DialogEngineException error = assertThrows(DialogEngineException.class, factory::init);

        assertTrue(error.is(DialogEngineErrorCode.DUPLICATE_STEP_HANDLER));
    }

    @Test
    void initRejectsMissingHandlers() {
        StepHandlerFactory factory = new StepHandlerFactory(List.of(new ForeachStepHandler()));

        DialogEngineException error = assertThrows(DialogEngineException.class, factory::init);

        assertTrue(error.is(DialogEngineErrorCode.MISSING_STEP_HANDLER));
    }

    @Test
    void loopHandlerRejectsNonLoopKinds() {
        StepHandlerFactory factory = new DialogEngineTestSupport().getStepHandlerFactory();

        DialogEngineException error = assertThrows(DialogEngineException.class,
                () -> factory.loopHandler(StepKind.SEND_OUTPUT));

        assertTrue(error.is(DialogEngineErrorCode.INVALID_STEP));
    }
}
