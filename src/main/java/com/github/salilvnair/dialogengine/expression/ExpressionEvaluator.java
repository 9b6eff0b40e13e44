package com.github.salilvnair.dialogengine.expression;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;

public interface ExpressionEvaluator {

    /**
     * @throws DialogEngineException {@code EXPRESSION_EVALUATION_FAILED} for malformed
     *                               expressions or type mismatches
     */
    Object evaluate(String expression, DialogMemory memory);

    /**
     * Blank conditions hold, {@code null} results do not.
     */
    default boolean evaluateCondition(String expression, DialogMemory memory) {
        if (expression == null || expression.isBlank()) {
            return true;
        }
        Object value = evaluate(expression, memory);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean result) {
            return result;
        }
        throw new DialogEngineException(DialogEngineErrorCode.EXPRESSION_EVALUATION_FAILED,
                "Condition '" + expression + "' evaluated to " + value.getClass().getSimpleName() + ", expected boolean");
    }
}
