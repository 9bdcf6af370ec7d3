package com.flowgraph.flowgraph_engine.engine;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionResult;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

/**
 * Observer of run progress. Callbacks arrive on the thread executing the run;
 * a listener that throws is logged and ignored.
 */
public interface ExecutionListener {

    default void onExecutionStarted(String executionId, String graphId) {}

    default void onNodeStarted(String executionId, String nodeId) {}

    default void onNodeCompleted(String executionId, String nodeId, GraphState state) {}

    default void onExecutionFinished(ExecutionResult result) {}
}
