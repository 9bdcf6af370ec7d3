package com.flowgraph.flowgraph_engine.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * The run outlived its wall-clock budget. Reported as a failure, not a cancellation.
 */
@Getter
public class ExecutionTimeoutException extends ExecutionCancelledException {

    private static final long serialVersionUID = 1L;

    private final Duration timeout;

    public ExecutionTimeoutException(Duration timeout) {
        super(ErrorCode.TIMEOUT, "execution timed out after " + timeout);
        this.timeout = timeout;
    }
}
