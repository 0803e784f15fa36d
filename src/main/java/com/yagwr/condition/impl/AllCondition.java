package com.yagwr.condition.impl;

import com.yagwr.condition.Condition;
import com.yagwr.condition.ConditionType;

import java.util.List;
import java.util.Map;

/**
 * Logical AND condition - all nested conditions must be true.
 */
public class AllCondition extends CompositeCondition {

    public AllCondition(List<Condition> conditions) {
        super(conditions);
    }

    @Override
    public boolean evaluate(Map<String, String> data) {
        return conditions.stream().allMatch(c -> c.evaluate(data)); // Empty ALL is true
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALL;
    }
}
