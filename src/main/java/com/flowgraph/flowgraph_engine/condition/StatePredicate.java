package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

/**
 * Native predicate for {@link CustomCondition}. May throw; checked exceptions are
 * reported as condition evaluation failures.
 */
@FunctionalInterface
public interface StatePredicate {

    boolean test(ExecutionContext ctx, GraphState state) throws Exception;
}
