package com.reporting.domain.condition;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Evaluates rule conditions against the current working data.
 * A blank condition is always true.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    /**
     * @throws com.reporting.domain.exception.ConditionSyntaxException when the expression does not parse
     */
    public boolean evaluate(String expression, JsonNode data) {
        if (expression == null || expression.isBlank()) {
            return true;
        }
        boolean outcome = ConditionParser.compile(expression).test(data);
        log.debug("Condition '{}' evaluated to {}", expression, outcome);
        return outcome;
    }
}
