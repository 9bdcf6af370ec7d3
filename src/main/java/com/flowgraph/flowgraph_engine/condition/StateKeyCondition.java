package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.exception.TypeCoercionException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import com.flowgraph.flowgraph_engine.model.state.StateValues;
import lombok.Getter;

import java.util.Map;

/**
 * Leaf predicate comparing one payload entry against an expected value.
 *
 * <p>A missing key never raises: {@code not_exists} and {@code not_equals} hold,
 * every other operator is false. {@code greater}/{@code less} coerce both sides
 * to numbers and {@code contains} accepts strings, sequences and maps; any other
 * operand shape raises {@link TypeCoercionException}.
 */
@Getter
public class StateKeyCondition implements Condition {

    private final String key;
    private final ConditionOperator operator;
    private final Object expected;

    public StateKeyCondition(String key, ConditionOperator operator, Object expected) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("condition key must not be blank");
        }
        if (operator == null) {
            throw new ValidationException("condition operator must not be null");
        }
        this.key = key;
        this.operator = operator;
        this.expected = StateValues.deepCopy(expected);
    }

    public StateKeyCondition(String key, String operator, Object expected) {
        this(key, ConditionOperator.fromValue(operator), expected);
    }

    @Override
    public boolean evaluate(ExecutionContext ctx, GraphState state) {
        if (!state.has(key)) {
            return operator == ConditionOperator.NOT_EXISTS || operator == ConditionOperator.NOT_EQUALS;
        }
        Object actual = state.get(key).orElse(null);
        return switch (operator) {
            case EXISTS     -> true;
            case NOT_EXISTS -> false;
            case EQUALS     -> StateValues.deepEquals(actual, expected);
            case NOT_EQUALS -> !StateValues.deepEquals(actual, expected);
            case GREATER    -> StateValues.toNumber(actual).compareTo(StateValues.toNumber(expected)) > 0;
            case LESS       -> StateValues.toNumber(actual).compareTo(StateValues.toNumber(expected)) < 0;
            case CONTAINS   -> contains(actual, expected);
        };
    }

    private boolean contains(Object container, Object item) {
        if (container instanceof String s) {
            if (item instanceof String sub) return s.contains(sub);
            throw new TypeCoercionException("key '" + key + "': string can only contain a string, got " + typeName(item));
        }
        if (StateValues.isSequence(container)) {
            return StateValues.containsElement(container, item);
        }
        if (container instanceof Map<?, ?> map) {
            if (item instanceof String k) return map.containsKey(k);
            throw new TypeCoercionException("key '" + key + "': map key lookup needs a string, got " + typeName(item));
        }
        throw new TypeCoercionException("key '" + key + "': contains is not supported on " + typeName(container));
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    @Override
    public String getDescription() {
        return switch (operator) {
            case EXISTS, NOT_EXISTS -> "key '" + key + "' " + operator.getValue();
            default -> "key '" + key + "' " + operator.getValue() + " " + expected;
        };
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
