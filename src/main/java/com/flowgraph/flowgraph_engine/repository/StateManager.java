package com.flowgraph.flowgraph_engine.repository;

import com.flowgraph.flowgraph_engine.model.state.GraphState;

import java.util.List;
import java.util.Map;

/**
 * Checkpoint store for run states. Implementations exchange copies only: callers
 * never observe or hold the stored instance.
 */
public interface StateManager {

    String FILTER_GRAPH_ID = "graph_id";
    String FILTER_USER_ID = "user_id";
    String FILTER_SESSION_ID = "session_id";

    void saveState(GraphState state);

    /** @throws com.flowgraph.flowgraph_engine.exception.NotFoundException if no state has this id */
    GraphState loadState(String stateId);

    // No-op when absent
    void deleteState(String stateId);

    /**
     * States matching every filter. {@code graph_id}, {@code user_id} and
     * {@code session_id} match identity fields; any other key matches a payload
     * entry by structural equality. Null or empty filters match all.
     */
    List<GraphState> listStates(Map<String, Object> filters);
}
