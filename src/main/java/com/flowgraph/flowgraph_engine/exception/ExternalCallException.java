package com.flowgraph.flowgraph_engine.exception;

/**
 * A text-generation client or tool failed.
 */
public class ExternalCallException extends FlowGraphException {

    private static final long serialVersionUID = 1L;

    public ExternalCallException(String message) {
        super(ErrorCode.EXTERNAL_CALL, message);
    }

    public ExternalCallException(String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_CALL, message, cause);
    }
}
