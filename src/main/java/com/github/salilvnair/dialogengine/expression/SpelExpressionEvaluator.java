package com.github.salilvnair.dialogengine.expression;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import com.github.salilvnair.dialogengine.util.JsonPathUtil;
import com.github.salilvnair.dialogengine.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SpEL over the memory scopes ({@code user.name == null}, {@code turn.value.length() > 3}).
 * Expressions starting with {@code $} are JSONPath over the same scopes.
 */
@Slf4j
public class SpelExpressionEvaluator implements ExpressionEvaluator {

    private final SpelExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();

    @Override
    public Object evaluate(String expression, DialogMemory memory) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        if (JsonPathUtil.isJsonPath(expression)) {
            return JsonPathUtil.first(JsonUtil.toTree(memory.scopes()), expression.trim());
        }
        try {
            Expression parsed = cache.computeIfAbsent(expression, parser::parseExpression);
            return parsed.getValue(context(memory));
        } catch (ExpressionException e) {
            log.debug("Expression '{}' failed: {}", expression, e.getMessage());
            throw new DialogEngineException(DialogEngineErrorCode.EXPRESSION_EVALUATION_FAILED,
                    "Failed to evaluate '" + expression + "': " + e.getMessage(), e);
        }
    }

    @Override
    public boolean evaluateCondition(String expression, DialogMemory memory) {
        if (JsonPathUtil.isJsonPath(expression)) {
            return JsonPathConditionEvaluator.evaluate(JsonUtil.toTree(memory.scopes()), expression);
        }
        return ExpressionEvaluator.super.evaluateCondition(expression, memory);
    }

    private EvaluationContext context(DialogMemory memory) {
        return SimpleEvaluationContext
                .forPropertyAccessors(new MemoryMapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                .withInstanceMethods()
                .withRootObject(memory.scopes())
                .build();
    }
}
