package com.yagwr.condition.impl;

import com.yagwr.condition.Condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared state of the ALL and ANY conditions.
 */
abstract class CompositeCondition implements Condition {

    protected final List<Condition> conditions;

    protected CompositeCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public Object toDescription() {
        List<Object> children = new ArrayList<>(conditions.size());
        for (Condition condition : conditions) {
            children.add(condition.toDescription());
        }
        return Map.of(getType().descriptionKey(), children);
    }

    @Override
    public String toString() {
        return getType() + "(" + conditions + ")";
    }
}
