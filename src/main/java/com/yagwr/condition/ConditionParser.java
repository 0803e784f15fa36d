package com.yagwr.condition;

import com.yagwr.condition.impl.AllCondition;
import com.yagwr.condition.impl.AnyCondition;
import com.yagwr.condition.impl.LiteralCondition;
import com.yagwr.condition.impl.NotCondition;
import com.yagwr.exception.InvalidExpressionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link Condition} trees from condition descriptions.
 * <p>
 * A description is either a literal string such as {@code "gitlab_event = Push Hook"}
 * or a single-key map whose key is one of {@code any}, {@code all}, {@code not}
 * (case-insensitive) and whose value is a list of nested descriptions:
 * <pre>
 * any:
 *   - "akane != kun"
 *   - all:
 *       - "genma = san"
 *       - "nabiki ~= tendou?"
 * </pre>
 * Literal operators are {@code =}, {@code !=}, {@code ~=} (regex matching from the start of
 * the value) and {@code !~=}.
 */
public final class ConditionParser {

    private ConditionParser() {
    }

    /**
     * Parse a condition description.
     *
     * @param description a {@code String} literal or a single-key {@code Map}
     * @return the root of the condition tree
     * @throws InvalidExpressionException if the description is malformed
     */
    public static Condition parse(Object description) {
        if (description instanceof String literal) {
            return LiteralCondition.parse(literal);
        }

        if (!(description instanceof Map<?, ?> map)) {
            throw new InvalidExpressionException(
                    description + " needs to be either a string or a mapping");
        }

        if (map.size() != 1) {
            throw new InvalidExpressionException("mapping must have exactly one key, found " + map.size());
        }

        Map.Entry<?, ?> entry = map.entrySet().iterator().next();
        ConditionType type = operatorType(entry.getKey());
        Object value = entry.getValue();

        return switch (type) {
            case NOT -> createNotCondition(value);
            case ALL -> new AllCondition(parseOperands(type, value));
            case ANY -> new AnyCondition(parseOperands(type, value));
            case LITERAL -> throw new IllegalStateException("literal is not an operator");
        };
    }

    private static ConditionType operatorType(Object key) {
        String name = String.valueOf(key).toLowerCase();
        return switch (name) {
            case "not" -> ConditionType.NOT;
            case "all" -> ConditionType.ALL;
            case "any" -> ConditionType.ANY;
            default -> throw new InvalidExpressionException("'" + key + "' is not a valid operator");
        };
    }

    private static Condition createNotCondition(Object value) {
        if (!(value instanceof List<?> operands)) {
            throw new InvalidExpressionException("NOT operator expects a list");
        }
        if (operands.size() != 1) {
            throw new InvalidExpressionException("NOT operator expects exactly one element in the list");
        }
        return new NotCondition(parse(operands.get(0)));
    }

    private static List<Condition> parseOperands(ConditionType type, Object value) {
        if (!(value instanceof List<?> operands)) {
            throw new InvalidExpressionException(type + " operator expects a list");
        }
        List<Condition> conditions = new ArrayList<>(operands.size());
        for (Object operand : operands) {
            conditions.add(parse(operand));
        }
        return conditions;
    }
}
