package com.flowgraph.flowgraph_engine.exception;

/**
 * The run's context was cancelled, either explicitly or through its parent context.
 */
public class ExecutionCancelledException extends FlowGraphException {

    private static final long serialVersionUID = 1L;

    public ExecutionCancelledException(String message) {
        super(ErrorCode.CANCELLED, message);
    }

    protected ExecutionCancelledException(ErrorCode code, String message) {
        super(code, message);
    }
}
