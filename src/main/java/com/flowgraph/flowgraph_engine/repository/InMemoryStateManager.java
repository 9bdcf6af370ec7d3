package com.flowgraph.flowgraph_engine.repository;

import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import com.flowgraph.flowgraph_engine.model.state.StateValues;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
public class InMemoryStateManager implements StateManager {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, GraphState> states = new LinkedHashMap<>();

    @Override
    public void saveState(GraphState state) {
        if (state == null) {
            throw new ValidationException("cannot save a null state");
        }
        GraphState copy = state.copy();
        lock.writeLock().lock();
        try {
            states.put(copy.getId(), copy);
        } finally {
            lock.writeLock().unlock();
        }
        log.trace("Saved state {} v{}", copy.getId(), copy.getVersion());
    }

    @Override
    public GraphState loadState(String stateId) {
        lock.readLock().lock();
        try {
            GraphState state = states.get(stateId);
            if (state == null) {
                throw new NotFoundException("state not found: " + stateId);
            }
            return state.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void deleteState(String stateId) {
        lock.writeLock().lock();
        try {
            states.remove(stateId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<GraphState> listStates(Map<String, Object> filters) {
        lock.readLock().lock();
        try {
            List<GraphState> matches = new ArrayList<>();
            for (GraphState state : states.values()) {
                if (matches(state, filters)) {
                    matches.add(state.copy());
                }
            }
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return states.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            states.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean matches(GraphState state, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) return true;
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            boolean ok = switch (filter.getKey()) {
                case FILTER_GRAPH_ID   -> Objects.equals(state.getGraphId(), filter.getValue());
                case FILTER_USER_ID    -> Objects.equals(state.getUserId(), filter.getValue());
                case FILTER_SESSION_ID -> Objects.equals(state.getSessionId(), filter.getValue());
                default -> state.has(filter.getKey())
                        && StateValues.deepEquals(state.get(filter.getKey()).orElse(null), filter.getValue());
            };
            if (!ok) return false;
        }
        return true;
    }
}
