package com.flowgraph.flowgraph_engine.exception;

/**
 * A state, node, tool or text-generation provider could not be resolved.
 */
public class NotFoundException extends FlowGraphException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
