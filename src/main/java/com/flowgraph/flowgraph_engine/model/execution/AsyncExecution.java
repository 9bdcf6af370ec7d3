package com.flowgraph.flowgraph_engine.model.execution;

import java.util.concurrent.CompletableFuture;

/**
 * Handle returned by an asynchronous run. The id is already registered in the
 * ledger when this is handed out, so it can be polled or cancelled right away.
 */
public record AsyncExecution(String executionId, CompletableFuture<ExecutionResult> result) {
}
