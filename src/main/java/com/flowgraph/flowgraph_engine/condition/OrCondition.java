package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

import java.util.List;
import java.util.stream.Collectors;

/** Disjunction; stops at the first true child. Empty is false. */
public class OrCondition implements Condition {

    private final List<Condition> conditions;

    public OrCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(ExecutionContext ctx, GraphState state) {
        for (Condition condition : conditions) {
            if (condition.evaluate(ctx, state)) return true;
        }
        return false;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public String getDescription() {
        if (conditions.isEmpty()) return "always false";
        return conditions.stream().map(Condition::getDescription).collect(Collectors.joining(" OR ", "(", ")"));
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
