package com.yagwr.condition.impl;

import com.yagwr.condition.Condition;
import com.yagwr.condition.ConditionType;
import com.yagwr.condition.LiteralOperator;
import com.yagwr.exception.InvalidExpressionException;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Terminal condition of the form {@code key <op> value}.
 * <p>
 * Key and value are trimmed before comparison. The original expression is kept
 * verbatim so the condition serializes back to exactly what was parsed.
 */
public class LiteralCondition implements Condition {

    private static final Pattern EXPRESSION = Pattern.compile(
            "^(?<lhs>\\w[\\w\\s]*)(?<op>=|!=|~=|!~=)(?<rhs>.*)$",
            Pattern.UNICODE_CHARACTER_CLASS);

    private final String expression;
    private final String field;
    private final LiteralOperator operator;
    private final String operand;
    private final Pattern pattern;

    private LiteralCondition(String expression, String field, LiteralOperator operator, String operand) {
        this.expression = expression;
        this.field = field;
        this.operator = operator;
        this.operand = operand;
        this.pattern = operator.isRegex() ? compile(expression, operand) : null;
    }

    /**
     * Parse a literal expression such as {@code "gitlab_event = Push Hook"}.
     *
     * @throws InvalidExpressionException if the expression is not {@code key<op>value}
     */
    public static LiteralCondition parse(String expression) {
        Matcher m = EXPRESSION.matcher(expression);
        if (!m.find()) {
            throw new InvalidExpressionException("'" + expression + "' is not a valid key<OP>value expression");
        }
        return new LiteralCondition(
                expression,
                m.group("lhs").strip(),
                LiteralOperator.fromSymbol(m.group("op")),
                m.group("rhs").strip());
    }

    private static Pattern compile(String expression, String regex) {
        try {
            return Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
        } catch (PatternSyntaxException e) {
            throw new InvalidExpressionException(
                    "'" + expression + "' contains an invalid regular expression: " + e.getDescription(), e);
        }
    }

    @Override
    public boolean evaluate(Map<String, String> data) {
        String actual = data.get(field);
        if (actual == null) {
            return false; // Missing key = condition is false
        }

        String value = actual.strip();
        return switch (operator) {
            case EQ -> operand.equals(value);
            case NEQ -> !operand.equals(value);
            case MATCH -> pattern.matcher(value).lookingAt();
            case NOT_MATCH -> !pattern.matcher(value).lookingAt();
        };
    }

    public String getField() {
        return field;
    }

    public LiteralOperator getOperator() {
        return operator;
    }

    public String getOperand() {
        return operand;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.LITERAL;
    }

    @Override
    public Object toDescription() {
        return expression;
    }

    @Override
    public String toString() {
        return field + " " + operator.symbol() + " " + operand;
    }
}
