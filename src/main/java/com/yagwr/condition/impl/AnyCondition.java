package com.yagwr.condition.impl;

import com.yagwr.condition.Condition;
import com.yagwr.condition.ConditionType;

import java.util.List;
import java.util.Map;

/**
 * Logical OR condition - at least one nested condition must be true.
 */
public class AnyCondition extends CompositeCondition {

    public AnyCondition(List<Condition> conditions) {
        super(conditions);
    }

    @Override
    public boolean evaluate(Map<String, String> data) {
        return conditions.stream().anyMatch(c -> c.evaluate(data));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ANY;
    }
}
