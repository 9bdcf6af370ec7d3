package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

/** Last-step hook run by an {@link EndNode} over its own copy of the state. */
@FunctionalInterface
public interface StateFinalizer {

    void accept(ExecutionContext ctx, GraphState state) throws Exception;
}
