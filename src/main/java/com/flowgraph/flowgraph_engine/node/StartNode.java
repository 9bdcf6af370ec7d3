package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import com.flowgraph.flowgraph_engine.model.state.StateValues;

import java.util.Map;

/**
 * Entry node. Seeds the state with a fixed set of initial values.
 */
public class StartNode extends AbstractNode {

    public static final String META_EXECUTION_STARTED = "execution_started";

    private final Map<String, Object> initialData;

    public StartNode(String id, String name, Map<String, ?> initialData) {
        super(id, name, NodeType.START, "Graph entry point");
        this.initialData = StateValues.deepCopyMap(initialData);
    }

    public StartNode(String id, String name) {
        this(id, name, null);
    }

    @Override
    public GraphState execute(ExecutionContext ctx, GraphState state) {
        GraphState next = state.copy();
        if (!initialData.isEmpty()) {
            next.setMultiple(StateValues.deepCopyMap(initialData));
        }
        next.setMetadata(META_EXECUTION_STARTED, now());
        return next;
    }

    public Map<String, Object> getInitialData() {
        return StateValues.deepCopyMap(initialData);
    }
}
