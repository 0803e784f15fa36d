package com.yagwr.condition;

import java.util.Arrays;

/**
 * Operators allowed between the key and the value of a literal condition.
 */
public enum LiteralOperator {
    EQ("="),
    NEQ("!="),
    MATCH("~="),
    NOT_MATCH("!~=");

    private final String symbol;

    LiteralOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isRegex() {
        return this == MATCH || this == NOT_MATCH;
    }

    public static LiteralOperator fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + symbol));
    }
}
