package com.flowgraph.flowgraph_engine.model.execution;

import com.flowgraph.flowgraph_engine.exception.ExecutionCancelledException;
import com.flowgraph.flowgraph_engine.exception.ExecutionTimeoutException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cancellation and deadline scope for one run. Contexts form a chain: a child is
 * cancelled when its parent is, and its deadline never outlives the parent's.
 *
 * <p>Nodes and conditions receive the context so long-running work (text-generation
 * calls, tools) can observe {@link #remaining()} and {@link #isCancelled()}.
 */
public final class ExecutionContext {

    private static final ExecutionContext BACKGROUND = new ExecutionContext(null, null, null);

    private final ExecutionContext parent;
    private final Instant deadline;
    private final Duration timeout;

    private volatile boolean cancelled;
    private volatile String cancelReason;

    private ExecutionContext(ExecutionContext parent, Instant deadline, Duration timeout) {
        this.parent = parent;
        this.deadline = deadline;
        this.timeout = timeout;
    }

    /** Root context: never cancelled, no deadline. */
    public static ExecutionContext background() {
        return BACKGROUND;
    }

    /** Child with its own cancel switch and no additional deadline. */
    public ExecutionContext withCancel() {
        return new ExecutionContext(this, null, null);
    }

    /**
     * Child that expires after {@code timeout}. Null or non-positive means no deadline of its own,
     * as does a timeout too large to land on the time-line.
     */
    public ExecutionContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return withCancel();
        }
        Instant deadline;
        try {
            deadline = Instant.now().plus(timeout);
        } catch (ArithmeticException | DateTimeException e) {
            return withCancel();
        }
        return new ExecutionContext(this, deadline, timeout);
    }

    /** Cancels this context and every child derived from it. The background context ignores this. */
    public void cancel(String reason) {
        if (this == BACKGROUND) return;
        if (!cancelled) {
            cancelReason = reason;
            cancelled = true;
        }
    }

    public boolean isCancelled() {
        if (cancelled) return true;
        return parent != null && parent.isCancelled();
    }

    public boolean isExpired() {
        if (deadline != null && !Instant.now().isBefore(deadline)) return true;
        return parent != null && parent.isExpired();
    }

    /** Time left before the nearest deadline in the chain, empty when none applies. */
    public Optional<Duration> remaining() {
        Instant nearest = nearestDeadline();
        if (nearest == null) return Optional.empty();
        Duration left = Duration.between(Instant.now(), nearest);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * @throws ExecutionCancelledException if this context or an ancestor was cancelled
     * @throws ExecutionTimeoutException   if a deadline in the chain has passed
     */
    public void checkActive() {
        if (isCancelled()) {
            throw new ExecutionCancelledException(reason());
        }
        if (isExpired()) {
            throw new ExecutionTimeoutException(expiredTimeout());
        }
    }

    private String reason() {
        if (cancelled) return cancelReason != null ? cancelReason : "execution cancelled";
        return parent != null ? parent.reason() : "execution cancelled";
    }

    private Duration expiredTimeout() {
        if (deadline != null && !Instant.now().isBefore(deadline)) return timeout;
        return parent != null ? parent.expiredTimeout() : Duration.ZERO;
    }

    private Instant nearestDeadline() {
        Instant inherited = parent != null ? parent.nearestDeadline() : null;
        if (deadline == null) return inherited;
        if (inherited == null) return deadline;
        return deadline.isBefore(inherited) ? deadline : inherited;
    }
}
