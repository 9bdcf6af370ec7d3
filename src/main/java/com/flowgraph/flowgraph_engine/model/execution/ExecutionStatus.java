package com.flowgraph.flowgraph_engine.model.execution;

import lombok.Getter;

@Getter
public enum ExecutionStatus {

    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
