package com.flowgraph.flowgraph_engine.graph;

import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.node.Node;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Nodes plus ordered, per-source edge lists. Mutable while being assembled;
 * {@link GraphBuilder#build()} seals it, after which it is read-only and may be
 * shared by concurrent runs.
 */
@Getter
public class Graph {

    private final String id;
    private final String name;
    private String description = "";
    private String entryPoint;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, List<Edge>> edges = new LinkedHashMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> exitPoints = new LinkedHashSet<>();

    private volatile boolean sealed;

    public Graph(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("graph id must not be blank");
        }
        this.id = id;
        this.name = name != null ? name : id;
    }

    // ── Assembly ──────────────────────────────────────────────────────────────

    public void setDescription(String description) {
        checkMutable();
        this.description = description != null ? description : "";
    }

    public void addNode(Node node) {
        checkMutable();
        if (node == null) {
            throw new ValidationException("node must not be null");
        }
        if (nodes.containsKey(node.getId())) {
            throw new ValidationException("node with id " + node.getId() + " already exists");
        }
        nodes.put(node.getId(), node);
    }

    public void addEdge(Edge edge) {
        checkMutable();
        if (edge == null) {
            throw new ValidationException("edge must not be null");
        }
        edges.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
    }

    public void setEntryPoint(String nodeId) {
        checkMutable();
        this.entryPoint = nodeId;
    }

    public void addExitPoint(String nodeId) {
        checkMutable();
        exitPoints.add(nodeId);
    }

    void seal() {
        sealed = true;
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("graph " + id + " is sealed and can no longer be modified");
        }
    }

    // ── Validation ────────────────────────────────────────────────────────────

    /** Reports the first structural problem found. */
    public void validate() {
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new ValidationException("no entry point defined");
        }
        if (!nodes.containsKey(entryPoint)) {
            throw new ValidationException("entry point node " + entryPoint + " does not exist");
        }
        if (exitPoints.isEmpty()) {
            throw new ValidationException("no exit points defined");
        }
        for (String exit : exitPoints) {
            if (!nodes.containsKey(exit)) {
                throw new ValidationException("exit point node " + exit + " does not exist");
            }
        }
        for (List<Edge> outgoing : edges.values()) {
            for (Edge edge : outgoing) {
                if (!nodes.containsKey(edge.from())) {
                    throw new ValidationException("edge source node " + edge.from() + " does not exist");
                }
                if (!nodes.containsKey(edge.to())) {
                    throw new ValidationException("edge target node " + edge.to() + " does not exist");
                }
            }
        }
        for (Node node : nodes.values()) {
            try {
                node.validate();
            } catch (ValidationException e) {
                throw new ValidationException("node " + node.getId() + " is invalid: " + e.getMessage(), e);
            }
        }
    }

    /** Nodes that no path from the entry point reaches. Diagnostic only. */
    public List<String> findUnreachableNodes() {
        Set<String> seen = new HashSet<>();
        if (entryPoint != null && nodes.containsKey(entryPoint)) {
            Deque<String> queue = new ArrayDeque<>();
            queue.add(entryPoint);
            seen.add(entryPoint);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (Edge edge : getEdges(current)) {
                    if (nodes.containsKey(edge.to()) && seen.add(edge.to())) {
                        queue.add(edge.to());
                    }
                }
            }
        }
        List<String> unreachable = new ArrayList<>();
        for (String nodeId : nodes.keySet()) {
            if (!seen.contains(nodeId)) unreachable.add(nodeId);
        }
        return unreachable;
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Map<String, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public List<Edge> getEdges(String sourceId) {
        List<Edge> outgoing = edges.get(sourceId);
        return outgoing != null ? Collections.unmodifiableList(outgoing) : List.of();
    }

    public boolean isExitPoint(String nodeId) {
        return exitPoints.contains(nodeId);
    }

    public Set<String> getExitPoints() {
        return Collections.unmodifiableSet(exitPoints);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        int count = 0;
        for (List<Edge> outgoing : edges.values()) count += outgoing.size();
        return count;
    }

    @Override
    public String toString() {
        return "Graph{id='" + id + "', nodes=" + nodes.size() + ", edges=" + getEdgeCount() + "}";
    }
}
