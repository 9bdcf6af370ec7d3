package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

/**
 * One step of a graph. Implementations never mutate the state they are given:
 * they copy it, change the copy and return that.
 */
public interface Node {

    String getId();

    String getName();

    NodeType getType();

    // Runs the step against a copy of the state and returns the new state
    GraphState execute(ExecutionContext ctx, GraphState state);

    /** @throws com.flowgraph.flowgraph_engine.exception.ValidationException when the node is misconfigured */
    void validate();
}
