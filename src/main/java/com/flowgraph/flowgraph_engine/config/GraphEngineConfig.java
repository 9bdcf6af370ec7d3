package com.flowgraph.flowgraph_engine.config;

import com.flowgraph.flowgraph_engine.engine.ExecutionEventPublisher;
import com.flowgraph.flowgraph_engine.engine.GraphExecutor;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionOptions;
import com.flowgraph.flowgraph_engine.repository.InMemoryStateManager;
import com.flowgraph.flowgraph_engine.repository.StateManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the engine: checkpoint store, async pool and executor.
 * A host application can replace the store by declaring its own {@link StateManager}.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(GraphEngineProperties.class)
public class GraphEngineConfig {

    public static final String EXECUTION_POOL = "graphExecutionPool";

    @Bean
    @ConditionalOnMissingBean(StateManager.class)
    public StateManager stateManager() {
        log.info("No StateManager bean provided, using in-memory checkpoint store");
        return new InMemoryStateManager();
    }

    @Bean(name = EXECUTION_POOL)
    @ConditionalOnMissingBean(name = EXECUTION_POOL)
    public ThreadPoolTaskExecutor graphExecutionPool(GraphEngineProperties properties) {
        GraphEngineProperties.Executor cfg = properties.getExecutor();
        int poolSize = Math.max(cfg.getAsyncPoolSize(), 1);
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(poolSize);
        pool.setMaxPoolSize(poolSize);
        pool.setQueueCapacity(Math.max(cfg.getAsyncQueueCapacity(), 0));
        pool.setThreadNamePrefix("graph-exec-");
        pool.setWaitForTasksToCompleteOnShutdown(true);
        pool.setAwaitTerminationSeconds(30);
        return pool;
    }

    @Bean
    public GraphExecutor graphExecutor(StateManager stateManager,
                                       @Qualifier(EXECUTION_POOL) ThreadPoolTaskExecutor graphExecutionPool,
                                       ExecutionEventPublisher eventPublisher,
                                       GraphEngineProperties properties) {
        ExecutionOptions defaults = ExecutionOptions.builder()
                .maxIterations(properties.getExecutor().getMaxIterations())
                .timeout(properties.getExecutor().getTimeout())
                .build();
        return new GraphExecutor(stateManager, graphExecutionPool, defaults, eventPublisher);
    }
}
