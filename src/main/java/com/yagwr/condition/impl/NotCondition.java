package com.yagwr.condition.impl;

import com.yagwr.condition.Condition;
import com.yagwr.condition.ConditionType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Logical NOT condition - negates the nested condition.
 */
public class NotCondition implements Condition {

    private final Condition condition;

    public NotCondition(Condition condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    @Override
    public boolean evaluate(Map<String, String> data) {
        return !condition.evaluate(data);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    public Object toDescription() {
        return Map.of(getType().descriptionKey(), List.of(condition.toDescription()));
    }

    @Override
    public String toString() {
        return "NOT(" + condition + ")";
    }
}
