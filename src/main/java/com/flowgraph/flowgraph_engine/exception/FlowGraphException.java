package com.flowgraph.flowgraph_engine.exception;

import lombok.Getter;

/**
 * Base of every error the engine raises. Unchecked; the code travels into the
 * {@code ExecutionResult} when a run fails.
 */
@Getter
public class FlowGraphException extends RuntimeException {

    private static final long serialVersionUID = -3017729405622153012L;

    private final ErrorCode code;

    public FlowGraphException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public FlowGraphException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Wraps {@code cause} with a context message, keeping the cause's code when it
     * is already one of ours and falling back to {@code fallback} otherwise.
     */
    public static FlowGraphException wrap(String message, Throwable cause, ErrorCode fallback) {
        ErrorCode code = cause instanceof FlowGraphException fge ? fge.getCode() : fallback;
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new FlowGraphException(code, message + ": " + detail, cause);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message='" + getMessage() + "'}";
    }
}
