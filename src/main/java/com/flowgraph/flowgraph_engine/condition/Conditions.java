package com.flowgraph.flowgraph_engine.condition;

import java.util.List;

/**
 * Static factory for the condition algebra.
 *
 * <pre>{@code
 * Conditions.and(Conditions.keyExists("user"), Conditions.greaterThan("score", 40))
 * }</pre>
 */
public final class Conditions {

    private Conditions() {}

    public static Condition keyExists(String key) {
        return new StateKeyCondition(key, ConditionOperator.EXISTS, null);
    }

    public static Condition keyMissing(String key) {
        return new StateKeyCondition(key, ConditionOperator.NOT_EXISTS, null);
    }

    public static Condition equalTo(String key, Object value) {
        return new StateKeyCondition(key, ConditionOperator.EQUALS, value);
    }

    public static Condition notEqualTo(String key, Object value) {
        return new StateKeyCondition(key, ConditionOperator.NOT_EQUALS, value);
    }

    public static Condition greaterThan(String key, Object value) {
        return new StateKeyCondition(key, ConditionOperator.GREATER, value);
    }

    public static Condition lessThan(String key, Object value) {
        return new StateKeyCondition(key, ConditionOperator.LESS, value);
    }

    public static Condition contains(String key, Object item) {
        return new StateKeyCondition(key, ConditionOperator.CONTAINS, item);
    }

    /** Operator given by name ({@code "greater"}, {@code "not_equals"}, ...). Unknown names fail validation. */
    public static Condition stateValue(String key, Object value, String operator) {
        return new StateKeyCondition(key, operator, value);
    }

    public static Condition and(Condition... conditions) {
        return new AndCondition(List.of(conditions));
    }

    public static Condition or(Condition... conditions) {
        return new OrCondition(List.of(conditions));
    }

    public static Condition not(Condition condition) {
        return new NotCondition(condition);
    }

    public static Condition alwaysTrue() {
        return ConstantCondition.TRUE;
    }

    public static Condition alwaysFalse() {
        return ConstantCondition.FALSE;
    }

    public static Condition custom(StatePredicate predicate, String description) {
        return new CustomCondition(predicate, description);
    }
}
