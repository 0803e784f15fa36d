package com.yagwr.condition;

import java.util.Map;

/**
 * Represents a boolean condition that can be evaluated against a flat string map.
 * Implementations are immutable; evaluation never modifies the condition or the data.
 */
public interface Condition {

    /**
     * Evaluate this condition against the given data.
     *
     * @param data String keys and values to check
     * @return true if condition matches, false otherwise
     */
    boolean evaluate(Map<String, String> data);

    /**
     * Get the condition type.
     */
    ConditionType getType();

    /**
     * Convert the condition back into the description it was parsed from.
     *
     * @return a {@code String} for literals, a single-key {@code Map} for compound conditions
     */
    Object toDescription();
}
