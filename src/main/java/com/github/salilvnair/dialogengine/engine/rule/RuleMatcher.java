package com.github.salilvnair.dialogengine.engine.rule;

import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import com.github.salilvnair.dialogengine.engine.model.DialogEvent;
import com.github.salilvnair.dialogengine.engine.rule.core.RuleTriggerResolver;
import com.github.salilvnair.dialogengine.engine.rule.factory.RuleTriggerResolverFactory;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the rule that handles an event: highest priority, then highest specificity,
 * then first registered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleMatcher {

    private final RuleTriggerResolverFactory triggerResolverFactory;
    private final ExpressionEvaluator expressionEvaluator;

    public Optional<DialogRule> selectRule(List<DialogRule> rules, DialogEvent event, DialogMemory memory) {
        DialogRule winner = null;
        int winnerSpecificity = Integer.MIN_VALUE;
        for (DialogRule rule : rules) {
            RuleTriggerResolver resolver = triggerResolverFactory.get(rule.triggerType());
            if (!resolver.matches(event, rule)) {
                continue;
            }
            if (!expressionEvaluator.evaluateCondition(rule.condition(), memory)) {
                log.debug("Rule {} {} matched event '{}' but its condition '{}' is false",
                        rule.triggerType(), rule.names(), event.getName(), rule.condition());
                continue;
            }
            int specificity = resolver.specificity(rule);
            // strict comparison keeps the earlier registration on a full tie
            if (winner == null
                    || rule.priority() > winner.priority()
                    || (rule.priority() == winner.priority() && specificity > winnerSpecificity)) {
                winner = rule;
                winnerSpecificity = specificity;
            }
        }
        return Optional.ofNullable(winner);
    }
}
