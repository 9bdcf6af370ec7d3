package com.flowgraph.flowgraph_engine.engine;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionResult;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

@Slf4j
@Component
public class ExecutionEventPublisher {

    private final List<ExecutionListener> listeners;

    @Autowired
    public ExecutionEventPublisher(ObjectProvider<ExecutionListener> listeners) {
        this.listeners = listeners.orderedStream().toList();
    }

    private ExecutionEventPublisher(List<ExecutionListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public static ExecutionEventPublisher of(ExecutionListener... listeners) {
        return new ExecutionEventPublisher(List.of(listeners));
    }

    public void executionStarted(String executionId, String graphId) {
        publish("executionStarted", executionId, l -> l.onExecutionStarted(executionId, graphId));
    }

    public void nodeStarted(String executionId, String nodeId) {
        publish("nodeStarted", executionId, l -> l.onNodeStarted(executionId, nodeId));
    }

    public void nodeCompleted(String executionId, String nodeId, GraphState state) {
        publish("nodeCompleted", executionId, l -> l.onNodeCompleted(executionId, nodeId, state));
    }

    public void executionFinished(ExecutionResult result) {
        publish("executionFinished", result.getExecutionId(), l -> l.onExecutionFinished(result));
    }

    public int getListenerCount() {
        return listeners.size();
    }

    private void publish(String event, String executionId, Consumer<ExecutionListener> callback) {
        for (ExecutionListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} for execution {}: {}",
                        listener.getClass().getSimpleName(), event, executionId, e.getMessage(), e);
            }
        }
    }
}
