package com.flowgraph.flowgraph_engine.config;

import com.flowgraph.flowgraph_engine.engine.GraphExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops finished executions from the ledger so it does not grow without bound.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionLedgerJanitor {

    private final GraphExecutor graphExecutor;
    private final GraphEngineProperties properties;

    @Scheduled(fixedDelayString = "${flowgraph.ledger.cleanup-interval-ms:300000}",
               initialDelayString = "${flowgraph.ledger.cleanup-interval-ms:300000}")
    public void evictFinished() {
        int removed = graphExecutor.cleanupExecutions(properties.getLedger().getRetention());
        if (removed > 0) {
            log.info("Ledger cleanup removed {} executions older than {}", removed, properties.getLedger().getRetention());
        }
    }
}
