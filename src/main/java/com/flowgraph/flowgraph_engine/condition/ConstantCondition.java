package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

public final class ConstantCondition implements Condition {

    public static final ConstantCondition TRUE = new ConstantCondition(true);
    public static final ConstantCondition FALSE = new ConstantCondition(false);

    private final boolean value;

    private ConstantCondition(boolean value) {
        this.value = value;
    }

    @Override
    public boolean evaluate(ExecutionContext ctx, GraphState state) {
        return value;
    }

    @Override
    public String getDescription() {
        return value ? "always true" : "always false";
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
