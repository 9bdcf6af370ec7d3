package com.flowgraph.flowgraph_engine.exception;

import lombok.Getter;

/**
 * Failure categories recorded on a failed execution and carried by every {@link FlowGraphException}.
 */
@Getter
public enum ErrorCode {

    VALIDATION("validation_error"),
    NOT_FOUND("not_found"),
    TYPE_COERCION("type_coercion_error"),
    EXTERNAL_CALL("external_call_error"),
    ITERATION_BUDGET_EXCEEDED("iteration_budget_exceeded"),
    CANCELLED("cancelled"),
    TIMEOUT("timeout"),
    NODE_EXECUTION("node_execution_error"),
    CONDITION_EVALUATION("condition_evaluation_error"),
    PERSISTENCE("persistence_error"),
    INTERNAL("internal_error");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }
}
