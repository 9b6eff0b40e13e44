package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import com.github.salilvnair.dialogengine.util.JsonUtil;

import java.util.LinkedHashMap;
import java.util.Map;

final class DialogOptions {

    private DialogOptions() {
    }

    /**
     * Evaluates option expressions against the caller's memory, before the child exists.
     */
    static Map<String, Object> evaluate(Map<String, String> options, ExpressionEvaluator evaluator, DialogMemory memory) {
        Map<String, Object> values = new LinkedHashMap<>();
        options.forEach((name, expression) -> values.put(name, JsonUtil.deepCopy(evaluator.evaluate(expression, memory))));
        return values;
    }
}
