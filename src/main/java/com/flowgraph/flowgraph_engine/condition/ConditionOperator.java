package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.exception.ValidationException;
import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
public enum ConditionOperator {

    EXISTS("exists"),
    NOT_EXISTS("not_exists"),
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER("greater"),
    LESS("less"),
    CONTAINS("contains");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    public static ConditionOperator fromValue(String value) {
        if (value != null) {
            for (ConditionOperator op : values()) {
                if (op.value.equalsIgnoreCase(value.trim())) return op;
            }
        }
        throw new ValidationException("unknown condition operator '" + value + "', expected one of "
                + Arrays.stream(values()).map(ConditionOperator::getValue).collect(Collectors.joining(", ")));
    }
}
