package com.flowgraph.flowgraph_engine.model.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-run knobs. Values left at their defaults fall back to the engine-wide
 * configuration under {@code flowgraph.executor.*}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionOptions {

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    @Builder.Default
    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    @Builder.Default
    private Duration timeout = DEFAULT_TIMEOUT;

    // Copied into ExecutionResult.metadata
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private String userId;
    private String sessionId;

    // When set, exit nodes execute (and are checkpointed) before the run stops
    private boolean runExitNodes;

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }
}
