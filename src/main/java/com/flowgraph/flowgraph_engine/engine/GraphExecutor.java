package com.flowgraph.flowgraph_engine.engine;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.ExecutionCancelledException;
import com.flowgraph.flowgraph_engine.exception.ExecutionTimeoutException;
import com.flowgraph.flowgraph_engine.exception.FlowGraphException;
import com.flowgraph.flowgraph_engine.exception.IterationBudgetExceededException;
import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.graph.Edge;
import com.flowgraph.flowgraph_engine.graph.Graph;
import com.flowgraph.flowgraph_engine.model.execution.AsyncExecution;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionOptions;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionResult;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionStats;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import com.flowgraph.flowgraph_engine.model.state.StateValues;
import com.flowgraph.flowgraph_engine.node.Node;
import com.flowgraph.flowgraph_engine.repository.StateManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs graphs. One call walks the graph from its entry point, executing one node
 * per hop, checkpointing the returned state and following the first matching
 * outgoing edge, until an exit point is reached, no edge matches, the iteration
 * budget runs out, the run times out or it is cancelled.
 *
 * <p>Every run, synchronous or not, is registered in the ledger under a fresh
 * execution id and can be inspected or cancelled through this executor.
 */
@Slf4j
public class GraphExecutor {

    public static final String META_ITERATIONS = "iterations";
    public static final String META_TERMINATION = "termination";
    public static final String META_EXIT_NODE = "exit_node";
    public static final String META_LAST_NODE = "last_node";
    public static final String TERMINATION_EXIT_POINT = "exit_point";
    public static final String TERMINATION_NO_MATCHING_EDGE = "no_matching_edge";

    private final StateManager stateManager;
    private final Executor asyncExecutor;
    private final ExecutionOptions defaults;
    private final ExecutionEventPublisher eventPublisher;
    private final ExecutionLedger ledger = new ExecutionLedger();

    public GraphExecutor(StateManager stateManager, Executor asyncExecutor,
                         ExecutionOptions defaults, ExecutionEventPublisher eventPublisher) {
        this.stateManager = stateManager;
        this.asyncExecutor = asyncExecutor;
        this.defaults = defaults != null ? defaults : ExecutionOptions.defaults();
        this.eventPublisher = eventPublisher != null ? eventPublisher : ExecutionEventPublisher.of();
    }

    public GraphExecutor(StateManager stateManager) {
        this(stateManager, ForkJoinPool.commonPool(), ExecutionOptions.defaults(), ExecutionEventPublisher.of());
    }

    // ── Entry points ──────────────────────────────────────────────────────────

    public ExecutionResult execute(Graph graph, Map<String, ?> input) {
        return execute(graph, input, null, null);
    }

    public ExecutionResult execute(Graph graph, Map<String, ?> input, ExecutionOptions options) {
        return execute(graph, input, options, null);
    }

    /**
     * Runs {@code graph} on the calling thread. Never throws for run-time failures:
     * they are reported through the returned result.
     */
    public ExecutionResult execute(Graph graph, Map<String, ?> input, ExecutionOptions options,
                                   ExecutionContext parent) {
        Run run = prepare(graph, input, options, parent);
        run.execute();
        return run.result;
    }

    public AsyncExecution executeAsync(Graph graph, Map<String, ?> input) {
        return executeAsync(graph, input, null);
    }

    /**
     * Registers the run and hands it to the async pool. The returned id is usable
     * right away; the future completes once with the terminal result.
     */
    public AsyncExecution executeAsync(Graph graph, Map<String, ?> input, ExecutionOptions options) {
        Run run = prepare(graph, input, options, null);
        CompletableFuture<ExecutionResult> future = new CompletableFuture<>();
        try {
            asyncExecutor.execute(() -> {
                try {
                    run.execute();
                } finally {
                    if (run.result.isRunning()) {
                        run.result.fail(null, "execution aborted", ErrorCode.INTERNAL);
                    }
                    future.complete(run.result);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Execution {} rejected by async pool: {}", run.result.getExecutionId(), e.getMessage());
            run.result.fail(null, "execution rejected: " + e.getMessage(), ErrorCode.INTERNAL);
            eventPublisher.executionFinished(run.result);
            future.complete(run.result);
        }
        return new AsyncExecution(run.result.getExecutionId(), future);
    }

    // ── Ledger ────────────────────────────────────────────────────────────────

    public Optional<ExecutionResult> getExecution(String executionId) {
        return ledger.get(executionId);
    }

    public List<ExecutionResult> listExecutions() {
        return ledger.list();
    }

    public void cancelExecution(String executionId) {
        ledger.cancel(executionId);
    }

    public int cleanupExecutions(Duration maxAge) {
        return ledger.cleanup(maxAge);
    }

    public ExecutionStats getExecutionStats() {
        return ledger.stats();
    }

    public ExecutionOptions getDefaults() {
        return defaults.toBuilder().build();
    }

    // ── Run ───────────────────────────────────────────────────────────────────

    private Run prepare(Graph graph, Map<String, ?> input, ExecutionOptions options, ExecutionContext parent) {
        if (graph == null) {
            throw new ValidationException("graph must not be null");
        }
        ExecutionOptions opts = resolve(options);
        ExecutionContext ctx = (parent != null ? parent : ExecutionContext.background()).withTimeout(opts.getTimeout());
        ExecutionResult result = new ExecutionResult(UUID.randomUUID().toString(), graph.getId());
        if (opts.getMetadata() != null) {
            opts.getMetadata().forEach(result::putMetadata);
        }
        ledger.register(result, ctx);
        return new Run(graph, StateValues.deepCopyMap(input), opts, ctx, result);
    }

    // Unset fields of the caller's options fall back to the executor defaults
    private ExecutionOptions resolve(ExecutionOptions options) {
        if (options == null) return defaults.toBuilder().build();
        ExecutionOptions.ExecutionOptionsBuilder merged = options.toBuilder();
        if (options.getMaxIterations() <= 0) merged.maxIterations(defaults.getMaxIterations());
        if (options.getTimeout() == null) merged.timeout(defaults.getTimeout());
        return merged.build();
    }

    private final class Run {

        private final Graph graph;
        private final Map<String, Object> input;
        private final ExecutionOptions options;
        private final ExecutionContext ctx;
        private final ExecutionResult result;

        private GraphState state;
        private int iteration;

        private Run(Graph graph, Map<String, Object> input, ExecutionOptions options,
                    ExecutionContext ctx, ExecutionResult result) {
            this.graph = graph;
            this.input = input;
            this.options = options;
            this.ctx = ctx;
            this.result = result;
        }

        void execute() {
            String executionId = result.getExecutionId();
            log.info("Execution {} started for graph {} (maxIterations={}, timeout={})",
                    executionId, graph.getId(), options.getMaxIterations(), options.getTimeout());
            eventPublisher.executionStarted(executionId, graph.getId());
            try {
                loop();
            } catch (ExecutionTimeoutException e) {
                log.warn("Execution {} timed out after {} iterations", executionId, iteration);
                finish(() -> result.fail(state, e.getMessage(), e.getCode()));
            } catch (ExecutionCancelledException e) {
                log.info("Execution {} cancelled after {} iterations", executionId, iteration);
                finish(() -> result.cancel(state, e.getMessage()));
            } catch (FlowGraphException e) {
                log.warn("Execution {} failed [{}]: {}", executionId, e.getCode().getValue(), e.getMessage());
                finish(() -> result.fail(state, e.getMessage(), e.getCode()));
            } catch (RuntimeException e) {
                log.error("Execution {} failed unexpectedly: {}", executionId, e.getMessage(), e);
                String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                finish(() -> result.fail(state, msg, ErrorCode.INTERNAL));
            } catch (Error e) {
                log.error("Execution {} aborted by {}", executionId, e.toString(), e);
                finish(() -> result.fail(state, e.getClass().getSimpleName() + ": " + e.getMessage(), ErrorCode.INTERNAL));
                throw e;
            } finally {
                log.info("Execution {} finished: status={} visited={} duration={}",
                        executionId, result.getStatus().getValue(), result.getVisitedNodes().size(), result.getDuration());
                eventPublisher.executionFinished(result);
            }
        }

        private void loop() {
            try {
                graph.validate();
            } catch (ValidationException e) {
                throw new ValidationException("graph validation failed: " + e.getMessage(), e);
            }

            state = new GraphState(UUID.randomUUID().toString(), graph.getId());
            state.setUserId(options.getUserId());
            state.setSessionId(options.getSessionId());
            if (!input.isEmpty()) {
                state.setMultiple(input);
            }
            persist(() -> "failed to save initial state");
            result.setInitialStateId(state.getId());

            String current = graph.getEntryPoint();
            while (iteration < options.getMaxIterations()) {
                iteration++;
                result.recordVisit(current);

                boolean exitPoint = graph.isExitPoint(current);
                if (exitPoint && !options.isRunExitNodes()) {
                    stopAtExit(current);
                    return;
                }

                final String nodeId = current;
                Node node = graph.getNode(nodeId)
                        .orElseThrow(() -> new NotFoundException("node not found: " + nodeId));
                runNode(node);
                persist(() -> "failed to save state after node " + nodeId);
                ctx.checkActive();

                if (exitPoint) {
                    stopAtExit(current);
                    return;
                }

                Optional<String> next = nextNode(current);
                if (next.isEmpty()) {
                    log.debug("Execution {}: no outgoing edge of {} matched, stopping", result.getExecutionId(), current);
                    result.putMetadata(META_ITERATIONS, iteration);
                    result.putMetadata(META_TERMINATION, TERMINATION_NO_MATCHING_EDGE);
                    result.putMetadata(META_LAST_NODE, current);
                    result.complete(state);
                    return;
                }
                current = next.get();
            }
            throw new IterationBudgetExceededException(options.getMaxIterations());
        }

        private void runNode(Node node) {
            String executionId = result.getExecutionId();
            log.debug("Execution {}: iteration {} running node {} ({})",
                    executionId, iteration, node.getId(), node.getType().getValue());
            eventPublisher.nodeStarted(executionId, node.getId());
            ctx.checkActive();
            GraphState next;
            try {
                next = node.execute(ctx, state);
            } catch (ExecutionCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw FlowGraphException.wrap("node " + node.getId() + " execution failed", e, ErrorCode.NODE_EXECUTION);
            }
            if (next == null) {
                throw new FlowGraphException(ErrorCode.NODE_EXECUTION,
                        "node " + node.getId() + " execution failed: node returned no state");
            }
            state = next;
            ctx.checkActive();
            eventPublisher.nodeCompleted(executionId, node.getId(), state.copy());
        }

        private void persist(Supplier<String> context) {
            try {
                stateManager.saveState(state);
            } catch (RuntimeException e) {
                throw FlowGraphException.wrap(context.get(), e, ErrorCode.PERSISTENCE);
            }
        }

        private Optional<String> nextNode(String current) {
            for (Edge edge : graph.getEdges(current)) {
                boolean matched;
                try {
                    matched = edge.matches(ctx, state);
                } catch (ExecutionCancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw FlowGraphException.wrap("failed to evaluate condition for edge " + edge.from() + "->" + edge.to(),
                            e, ErrorCode.CONDITION_EVALUATION);
                }
                if (matched) {
                    return Optional.of(edge.to());
                }
            }
            return Optional.empty();
        }

        private void stopAtExit(String exitNode) {
            log.debug("Execution {}: reached exit point {}", result.getExecutionId(), exitNode);
            result.putMetadata(META_ITERATIONS, iteration);
            result.putMetadata(META_TERMINATION, TERMINATION_EXIT_POINT);
            result.putMetadata(META_EXIT_NODE, exitNode);
            result.complete(state);
        }

        // Records the iteration count, then applies the terminal transition
        private void finish(Runnable transition) {
            result.putMetadata(META_ITERATIONS, iteration);
            transition.run();
        }
    }
}
