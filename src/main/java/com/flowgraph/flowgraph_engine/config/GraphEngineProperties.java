package com.flowgraph.flowgraph_engine.config;

import com.flowgraph.flowgraph_engine.node.UnresolvedPlaceholderPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings bound from {@code flowgraph.*}.
 */
@Data
@ConfigurationProperties(prefix = "flowgraph")
public class GraphEngineProperties {

    private Executor executor = new Executor();
    private Ledger ledger = new Ledger();
    private Template template = new Template();

    @Data
    public static class Executor {
        /** Hop cap per run when the caller does not set one. */
        private int maxIterations = 100;
        /** Wall-clock budget per run when the caller does not set one. */
        private Duration timeout = Duration.ofMinutes(5);
        private int asyncPoolSize = 4;
        private int asyncQueueCapacity = 100;
    }

    @Data
    public static class Ledger {
        /** Finished runs older than this are evicted by the janitor. */
        private Duration retention = Duration.ofHours(1);
        private long cleanupIntervalMs = 300_000L;
    }

    @Data
    public static class Template {
        private UnresolvedPlaceholderPolicy unresolvedPlaceholder = UnresolvedPlaceholderPolicy.EMPTY;
    }
}
