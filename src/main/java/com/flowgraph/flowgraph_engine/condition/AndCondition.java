package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

import java.util.List;
import java.util.stream.Collectors;

/** Conjunction; stops at the first false child. Empty is true. */
public class AndCondition implements Condition {

    private final List<Condition> conditions;

    public AndCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(ExecutionContext ctx, GraphState state) {
        for (Condition condition : conditions) {
            if (!condition.evaluate(ctx, state)) return false;
        }
        return true;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public String getDescription() {
        if (conditions.isEmpty()) return "always true";
        return conditions.stream().map(Condition::getDescription).collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
