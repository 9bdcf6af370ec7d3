package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

import java.util.Objects;

public class NotCondition implements Condition {

    private final Condition condition;

    public NotCondition(Condition condition) {
        this.condition = Objects.requireNonNull(condition, "negated condition");
    }

    @Override
    public boolean evaluate(ExecutionContext ctx, GraphState state) {
        return !condition.evaluate(ctx, state);
    }

    @Override
    public String getDescription() {
        return "NOT (" + condition.getDescription() + ")";
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
