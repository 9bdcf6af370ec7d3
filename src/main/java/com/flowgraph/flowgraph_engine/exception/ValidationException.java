package com.flowgraph.flowgraph_engine.exception;

/**
 * Raised when a graph, node or condition is malformed. Always surfaces before a run starts.
 */
public class ValidationException extends FlowGraphException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
