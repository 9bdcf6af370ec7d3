package com.flowgraph.flowgraph_engine.model.execution;

import java.time.Duration;
import java.util.Map;

/**
 * Ledger-wide aggregate. {@code averageDuration} covers finished runs only.
 */
public record ExecutionStats(
        int total,
        Map<ExecutionStatus, Integer> countsByStatus,
        Duration totalDuration,
        Duration averageDuration) {

    public int count(ExecutionStatus status) {
        return countsByStatus.getOrDefault(status, 0);
    }
}
