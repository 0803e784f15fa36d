package com.yagwr.condition;

/**
 * Supported condition node kinds.
 */
public enum ConditionType {
    // Terminal
    LITERAL,

    // Logical
    NOT,
    ALL,
    ANY;

    /**
     * Key used for this kind in a condition description ({@code not}, {@code all}, {@code any}).
     */
    public String descriptionKey() {
        return name().toLowerCase();
    }
}
