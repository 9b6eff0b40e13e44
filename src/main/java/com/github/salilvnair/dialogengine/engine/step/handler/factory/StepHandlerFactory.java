package com.github.salilvnair.dialogengine.engine.step.handler.factory;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.LoopStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class StepHandlerFactory {

    private final List<StepHandler> discoveredHandlers;

    private final Map<StepKind, StepHandler> handlers = new EnumMap<>(StepKind.class);

    /**
     * Every step kind needs exactly one handler.
     */
    @PostConstruct
    public void init() {
        handlers.clear();
        for (StepHandler handler : discoveredHandlers) {
            StepHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new DialogEngineException(DialogEngineErrorCode.DUPLICATE_STEP_HANDLER,
                        "Duplicate StepHandler for " + handler.kind() + ": "
                                + previous.getClass().getName() + ", " + handler.getClass().getName());
            }
        }
        List<StepKind> missing = Arrays.stream(StepKind.values())
                .filter(kind -> !handlers.containsKey(kind))
                .toList();
        if (!missing.isEmpty()) {
            throw new DialogEngineException(DialogEngineErrorCode.MISSING_STEP_HANDLER,
                    "No StepHandler registered for: " + missing);
        }
        log.debug("Registered {} step handlers", handlers.size());
    }

    public StepHandler get(StepKind kind) {
        StepHandler handler = handlers.get(kind);
        if (handler == null) {
            throw new DialogEngineException(DialogEngineErrorCode.MISSING_STEP_HANDLER,
                    "No StepHandler registered for " + kind);
        }
        return handler;
    }

    public LoopStepHandler loopHandler(StepKind kind) {
        if (get(kind) instanceof LoopStepHandler loopHandler) {
            return loopHandler;
        }
        throw new DialogEngineException(DialogEngineErrorCode.INVALID_STEP, kind + " does not drive a loop");
    }
}
