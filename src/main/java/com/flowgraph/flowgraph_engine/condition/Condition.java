package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

/**
 * Side-effect-free predicate over a state. Used on edges to pick the next hop
 * and inside {@code ConditionalNode}s to set branch flags.
 */
public interface Condition {

    boolean evaluate(ExecutionContext ctx, GraphState state);

    /** Human-readable rendering, e.g. {@code (key 'a' exists AND NOT (key 'b' equals 1))}. */
    String getDescription();
}
