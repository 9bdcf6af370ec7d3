package com.flowgraph.flowgraph_engine.graph;

import com.flowgraph.flowgraph_engine.condition.Condition;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed transition between two nodes. An edge without a condition always
 * matches. {@code weight} is informational only; selection is by registration order.
 */
public record Edge(String from, String to, Condition condition, String label, double weight,
                   Map<String, Object> metadata) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public Edge {
        Objects.requireNonNull(from, "edge source");
        Objects.requireNonNull(to, "edge target");
        label = label != null ? label : "";
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public static Edge of(String from, String to) {
        return new Edge(from, to, null, null, DEFAULT_WEIGHT, null);
    }

    public static Edge when(String from, String to, Condition condition) {
        return new Edge(from, to, condition, null, DEFAULT_WEIGHT, null);
    }

    public Edge withLabel(String label) {
        return new Edge(from, to, condition, label, weight, metadata);
    }

    public boolean isConditional() {
        return condition != null;
    }

    public boolean matches(ExecutionContext ctx, GraphState state) {
        return condition == null || condition.evaluate(ctx, state);
    }

    @Override
    public String toString() {
        return from + "->" + to + (condition != null ? " [" + condition.getDescription() + "]" : "");
    }
}
