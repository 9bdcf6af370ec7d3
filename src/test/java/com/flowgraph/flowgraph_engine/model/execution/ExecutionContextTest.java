package com.flowgraph.flowgraph_engine.model.execution;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.ExecutionCancelledException;
import com.flowgraph.flowgraph_engine.exception.ExecutionTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionContextTest {

    @Test
    void backgroundIsNeverCancelledOrExpired() {
        ExecutionContext ctx = ExecutionContext.background();
        ctx.cancel("ignored");

        assertThat(ctx.isCancelled()).isFalse();
        assertThat(ctx.isExpired()).isFalse();
        assertThat(ctx.remaining()).isEmpty();
        assertThatCode(ctx::checkActive).doesNotThrowAnyException();
    }

    @Test
    void cancellingParentCancelsChild() {
        ExecutionContext parent = ExecutionContext.background().withCancel();
        ExecutionContext child = parent.withTimeout(Duration.ofMinutes(1));

        parent.cancel("shutdown");

        assertThat(child.isCancelled()).isTrue();
        assertThatThrownBy(child::checkActive)
                .isExactlyInstanceOf(ExecutionCancelledException.class)
                .hasMessage("shutdown");
    }

    @Test
    void expiredDeadlineRaisesTimeout() {
        ExecutionContext ctx = ExecutionContext.background().withTimeout(Duration.ofNanos(1));

        await(ctx);

        assertThat(ctx.isExpired()).isTrue();
        assertThat(ctx.remaining()).contains(Duration.ZERO);
        assertThatThrownBy(ctx::checkActive)
                .isInstanceOf(ExecutionTimeoutException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.TIMEOUT)
                .hasMessageStartingWith("execution timed out after PT");
    }

    @Test
    void timeoutBeyondTimeLineMeansNoDeadline() {
        ExecutionContext ctx = ExecutionContext.background().withTimeout(Duration.ofSeconds(Long.MAX_VALUE));

        assertThat(ctx.remaining()).isEmpty();
        assertThat(ctx.isExpired()).isFalse();
        assertThatCode(ctx::checkActive).doesNotThrowAnyException();
    }

    @Test
    void remainingTakesNearestDeadlineInChain() {
        ExecutionContext outer = ExecutionContext.background().withTimeout(Duration.ofSeconds(5));
        ExecutionContext inner = outer.withTimeout(Duration.ofHours(1));

        assertThat(inner.remaining()).hasValueSatisfying(d -> assertThat(d).isLessThanOrEqualTo(Duration.ofSeconds(5)));
    }

    @Test
    void nonPositiveTimeoutMeansNoDeadline() {
        ExecutionContext ctx = ExecutionContext.background().withTimeout(Duration.ZERO);

        assertThat(ctx.remaining()).isEmpty();
        assertThat(ctx.isExpired()).isFalse();
    }

    private static void await(ExecutionContext ctx) {
        long until = System.nanoTime() + Duration.ofSeconds(1).toNanos();
        while (!ctx.isExpired() && System.nanoTime() < until) {
            Thread.onSpinWait();
        }
    }
}
