package com.yagwr.rule;

import com.yagwr.condition.Condition;
import com.yagwr.condition.ConditionParser;
import com.yagwr.exception.InvalidExpressionException;

import java.util.Map;
import java.util.Objects;

/**
 * A condition paired with the shell command to run when it matches.
 * The action is opaque: it is stored and handed to the executor without interpretation.
 *
 * @param condition Condition checked against the request projection
 * @param action    Command line executed when the condition matches
 */
public record Rule(Condition condition, String action) {

    public Rule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(action, "action");
    }

    /**
     * Check whether the condition matches the given data.
     */
    public boolean matches(Map<String, String> data) {
        return condition.evaluate(data);
    }

    /**
     * Create a rule from a mapping with the keys {@code condition} and {@code action}.
     *
     * @param description Mapping as read from the rules file
     * @return a new rule
     * @throws InvalidExpressionException if the condition is malformed or a key is missing
     */
    public static Rule fromDescription(Map<?, ?> description) {
        if (!description.containsKey("condition")) {
            throw new InvalidExpressionException("rule has no 'condition'");
        }
        Object action = description.get("action");
        if (action == null) {
            throw new InvalidExpressionException("rule has no 'action'");
        }
        Condition condition = ConditionParser.parse(description.get("condition"));
        return new Rule(condition, action.toString());
    }
}
