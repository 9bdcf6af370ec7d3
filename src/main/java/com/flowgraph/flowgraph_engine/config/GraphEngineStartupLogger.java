package com.flowgraph.flowgraph_engine.config;

import com.flowgraph.flowgraph_engine.engine.ExecutionEventPublisher;
import com.flowgraph.flowgraph_engine.node.llm.LlmClientRegistry;
import com.flowgraph.flowgraph_engine.node.tool.ToolRegistry;
import com.flowgraph.flowgraph_engine.repository.StateManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Logs at startup what the engine has to work with: providers, tools, store and limits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphEngineStartupLogger implements ApplicationRunner {

    private final GraphEngineProperties properties;
    private final LlmClientRegistry llmClients;
    private final ToolRegistry tools;
    private final StateManager stateManager;
    private final ExecutionEventPublisher eventPublisher;

    @Override
    public void run(ApplicationArguments args) {
        GraphEngineProperties.Executor executor = properties.getExecutor();
        log.info("Graph engine ready: maxIterations={}, timeout={}, asyncPool={} (queue {})",
                executor.getMaxIterations(), executor.getTimeout(),
                executor.getAsyncPoolSize(), executor.getAsyncQueueCapacity());
        log.info("State store: {}, execution listeners: {}",
                stateManager.getClass().getSimpleName(), eventPublisher.getListenerCount());
        if (llmClients.getProviders().isEmpty()) {
            log.warn("No LLM clients registered; graphs with LLM nodes will fail at run time");
        } else {
            log.info("LLM providers: {}", llmClients.getProviders());
        }
        log.info("Tools: {}", tools.getToolNames().isEmpty() ? "none" : tools.getToolNames());
    }
}
