package com.flowgraph.flowgraph_engine.engine;

import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionResult;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionStats;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of runs known to one {@link GraphExecutor}: the result record plus the
 * context used to cancel the run.
 */
@Slf4j
public class ExecutionLedger {

    private record Entry(ExecutionResult result, ExecutionContext context) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    void register(ExecutionResult result, ExecutionContext context) {
        entries.put(result.getExecutionId(), new Entry(result, context));
    }

    public Optional<ExecutionResult> get(String executionId) {
        Entry entry = executionId != null ? entries.get(executionId) : null;
        return Optional.ofNullable(entry).map(Entry::result);
    }

    /** All known runs, oldest first. */
    public List<ExecutionResult> list() {
        List<ExecutionResult> results = new ArrayList<>();
        entries.values().forEach(e -> results.add(e.result()));
        results.sort(Comparator.comparing(ExecutionResult::getStartTime));
        return results;
    }

    /**
     * Marks the run CANCELLED and signals its context. The run loop stops at its
     * next check; the record is already terminal by then.
     *
     * @throws NotFoundException     for an unknown id
     * @throws IllegalStateException if the run already finished
     */
    public void cancel(String executionId) {
        Entry entry = executionId != null ? entries.get(executionId) : null;
        if (entry == null) {
            throw new NotFoundException("execution not found: " + executionId);
        }
        if (!entry.result().isRunning()) {
            throw new IllegalStateException("execution " + executionId + " is not running (status: "
                    + entry.result().getStatus().getValue() + ")");
        }
        entry.context().cancel("execution cancelled");
        entry.result().cancel(null, "execution cancelled");
        log.info("Cancellation requested for execution {}", executionId);
    }

    /** Evicts finished runs that ended before {@code now - maxAge}. Returns the number removed. */
    public int cleanup(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            ExecutionResult result = it.next().result();
            Optional<Instant> end = result.getEndTime();
            if (result.getStatus().isTerminal() && end.isPresent() && end.get().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} finished executions older than {}", removed, maxAge);
        }
        return removed;
    }

    public ExecutionStats stats() {
        Map<ExecutionStatus, Integer> counts = new EnumMap<>(ExecutionStatus.class);
        for (ExecutionStatus status : ExecutionStatus.values()) counts.put(status, 0);
        Duration total = Duration.ZERO;
        int finished = 0;
        int all = 0;
        for (Entry entry : entries.values()) {
            ExecutionResult result = entry.result();
            ExecutionStatus status = result.getStatus();
            counts.merge(status, 1, Integer::sum);
            all++;
            if (status.isTerminal()) {
                total = total.plus(result.getDuration());
                finished++;
            }
        }
        Duration average = finished > 0 ? total.dividedBy(finished) : Duration.ZERO;
        return new ExecutionStats(all, counts, total, average);
    }

    public int size() {
        return entries.size();
    }
}
