package com.flowgraph.flowgraph_engine.model.execution;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ledger record of one run. Created RUNNING; exactly one of {@link #complete},
 * {@link #fail} or {@link #cancel} moves it to a terminal status, after which
 * every further transition is refused and the record no longer changes. The final
 * state is copied in and copied out.
 */
public class ExecutionResult {

    private final String executionId;
    private final String graphId;
    private final Instant startTime;

    private String initialStateId;
    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private Instant endTime;
    private Duration duration;
    private final List<String> visitedNodes = new ArrayList<>();
    private GraphState finalState;
    private String error;
    private ErrorCode errorCode;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public ExecutionResult(String executionId, String graphId) {
        this.executionId = executionId;
        this.graphId = graphId;
        this.startTime = Instant.now();
    }

    // ── Transitions ───────────────────────────────────────────────────────────

    public synchronized void setInitialStateId(String initialStateId) {
        if (status == ExecutionStatus.RUNNING) this.initialStateId = initialStateId;
    }

    public synchronized void recordVisit(String nodeId) {
        if (status == ExecutionStatus.RUNNING) visitedNodes.add(nodeId);
    }

    public synchronized void putMetadata(String key, Object value) {
        if (status == ExecutionStatus.RUNNING) metadata.put(key, value);
    }

    public synchronized boolean complete(GraphState state) {
        if (!finish(ExecutionStatus.COMPLETED)) return false;
        this.finalState = state != null ? state.copy() : null;
        return true;
    }

    public synchronized boolean fail(GraphState state, String error, ErrorCode code) {
        if (!finish(ExecutionStatus.FAILED)) return false;
        this.finalState = state != null ? state.copy() : null;
        this.error = error;
        this.errorCode = code;
        return true;
    }

    public synchronized boolean cancel(GraphState state, String reason) {
        if (!finish(ExecutionStatus.CANCELLED)) return false;
        this.finalState = state != null ? state.copy() : null;
        this.error = reason;
        this.errorCode = ErrorCode.CANCELLED;
        return true;
    }

    private boolean finish(ExecutionStatus terminal) {
        if (status != ExecutionStatus.RUNNING) return false;
        status = terminal;
        endTime = Instant.now();
        duration = Duration.between(startTime, endTime);
        return true;
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    public String getExecutionId()  { return executionId; }
    public String getGraphId()      { return graphId; }
    public Instant getStartTime()   { return startTime; }

    public synchronized String getInitialStateId()         { return initialStateId; }
    public synchronized ExecutionStatus getStatus()        { return status; }
    public synchronized Optional<Instant> getEndTime()     { return Optional.ofNullable(endTime); }
    public synchronized Optional<GraphState> getFinalState() {
        return Optional.ofNullable(finalState).map(GraphState::copy);
    }
    public synchronized Optional<String> getError()        { return Optional.ofNullable(error); }
    public synchronized Optional<ErrorCode> getErrorCode() { return Optional.ofNullable(errorCode); }
    public synchronized List<String> getVisitedNodes()     { return List.copyOf(visitedNodes); }
    public synchronized Map<String, Object> getMetadata()  { return new LinkedHashMap<>(metadata); }

    /** Elapsed time so far for a running execution, final duration otherwise. */
    public synchronized Duration getDuration() {
        return duration != null ? duration : Duration.between(startTime, Instant.now());
    }

    public synchronized boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }

    @Override
    public synchronized String toString() {
        return "ExecutionResult{id='" + executionId + "', graph='" + graphId + "', status=" + status
                + ", visited=" + visitedNodes + (error != null ? ", error='" + error + "'" : "") + "}";
    }
}
