package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

/**
 * Native step logic for a {@link FunctionNode}. Receives a private copy of the
 * state and returns the state to continue with (usually the same copy).
 */
@FunctionalInterface
public interface StateTransform {

    GraphState apply(ExecutionContext ctx, GraphState state) throws Exception;
}
