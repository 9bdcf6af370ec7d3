package com.flowgraph.flowgraph_engine.graph;

import com.flowgraph.flowgraph_engine.condition.Condition;
import com.flowgraph.flowgraph_engine.condition.Conditions;
import com.flowgraph.flowgraph_engine.condition.StatePredicate;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.node.ConditionalNode;
import com.flowgraph.flowgraph_engine.node.EndNode;
import com.flowgraph.flowgraph_engine.node.FunctionNode;
import com.flowgraph.flowgraph_engine.node.LlmNode;
import com.flowgraph.flowgraph_engine.node.Node;
import com.flowgraph.flowgraph_engine.node.PromptTemplateRenderer;
import com.flowgraph.flowgraph_engine.node.StartNode;
import com.flowgraph.flowgraph_engine.node.StateFinalizer;
import com.flowgraph.flowgraph_engine.node.StateTransform;
import com.flowgraph.flowgraph_engine.node.ToolNode;
import com.flowgraph.flowgraph_engine.node.llm.LlmClientRegistry;
import com.flowgraph.flowgraph_engine.node.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Fluent assembly of a {@link Graph}.
 *
 * <p>The builder keeps a cursor on the last node touched. {@code addStartNode}
 * and {@link #from(String)} place it, {@link #connectTo(String)} adds an
 * unconditional edge and moves it to the target, {@link #connectToIf} adds a
 * guarded edge and leaves it where it was, so several branches can fan out from
 * one node:
 *
 * <pre>{@code
 * new GraphBuilder("g", "example")
 *     .addStartNode("start", Map.of("n", 0))
 *     .addConditionalNode("check", "Check", Conditions.greaterThan("n", 5))
 *     .addFunctionNode("small", "Small", transform)
 *     .addEndNode("end", "End")
 *     .from("start").connectTo("check")
 *     .connectToIf("end", Conditions.keyExists(ConditionalNode.DEFAULT_TRUE_KEY))
 *     .connectToIf("small", Conditions.keyExists(ConditionalNode.DEFAULT_FALSE_KEY))
 *     .from("small").connectTo("end")
 *     .build();
 * }</pre>
 */
@Slf4j
public class GraphBuilder {

    private final Graph graph;
    private String cursor;
    private boolean built;

    private LlmClientRegistry llmClients;
    private ToolRegistry tools;
    private PromptTemplateRenderer promptRenderer;

    public GraphBuilder(String id, String name) {
        this.graph = new Graph(id, name);
    }

    // ── Collaborators ─────────────────────────────────────────────────────────

    public GraphBuilder description(String description) {
        checkNotBuilt();
        graph.setDescription(description);
        return this;
    }

    public GraphBuilder withLlmClients(LlmClientRegistry llmClients) {
        this.llmClients = llmClients;
        return this;
    }

    public GraphBuilder withTools(ToolRegistry tools) {
        this.tools = tools;
        return this;
    }

    public GraphBuilder withPromptRenderer(PromptTemplateRenderer promptRenderer) {
        this.promptRenderer = promptRenderer;
        return this;
    }

    // ── Nodes ─────────────────────────────────────────────────────────────────

    public GraphBuilder addStartNode(String id, Map<String, ?> initialData) {
        addNode(new StartNode(id, "Start", initialData));
        graph.setEntryPoint(id);
        cursor = id;
        return this;
    }

    public GraphBuilder addStartNode(String id) {
        return addStartNode(id, null);
    }

    public GraphBuilder addEndNode(String id, String name, StateFinalizer finalizer) {
        addNode(new EndNode(id, name, finalizer));
        graph.addExitPoint(id);
        return this;
    }

    public GraphBuilder addEndNode(String id, String name) {
        return addEndNode(id, name, null);
    }

    /** LLM node with default max tokens and temperature. */
    public GraphBuilder addLlmNode(String id, String name, String provider, String model,
                                   String promptTemplate, String outputKey) {
        return addNode(LlmNode.builder()
                .id(id).name(name)
                .provider(provider).model(model)
                .promptTemplate(promptTemplate).outputKey(outputKey)
                .clients(llmClients).renderer(promptRenderer)
                .build());
    }

    /** Fully configured LLM node. Registries bound on this builder override the node's own. */
    public GraphBuilder addLlmNode(LlmNode.LlmNodeBuilder node) {
        if (llmClients != null) node.clients(llmClients);
        if (promptRenderer != null) node.renderer(promptRenderer);
        return addNode(node.build());
    }

    public GraphBuilder addToolNode(String id, String name, String toolName, List<String> inputKeys, String outputKey) {
        return addNode(new ToolNode(id, name, toolName, inputKeys, outputKey, tools));
    }

    public GraphBuilder addFunctionNode(String id, String name, StateTransform transform) {
        return addNode(new FunctionNode(id, name, transform));
    }

    public GraphBuilder addConditionalNode(String id, String name, Condition condition) {
        return addNode(new ConditionalNode(id, name, condition));
    }

    public GraphBuilder addConditionalNode(String id, String name, StatePredicate predicate) {
        return addNode(new ConditionalNode(id, name, Conditions.custom(predicate, name)));
    }

    public GraphBuilder addNode(Node node) {
        checkNotBuilt();
        graph.addNode(node);
        return this;
    }

    public GraphBuilder setEntryPoint(String nodeId) {
        checkNotBuilt();
        graph.setEntryPoint(nodeId);
        return this;
    }

    public GraphBuilder addExitPoint(String nodeId) {
        checkNotBuilt();
        graph.addExitPoint(nodeId);
        return this;
    }

    // ── Edges ─────────────────────────────────────────────────────────────────

    public GraphBuilder from(String nodeId) {
        checkNotBuilt();
        cursor = nodeId;
        return this;
    }

    public GraphBuilder connectTo(String nodeId) {
        requireCursor();
        graph.addEdge(Edge.of(cursor, nodeId));
        cursor = nodeId;
        return this;
    }

    public GraphBuilder connectToIf(String nodeId, Condition condition) {
        requireCursor();
        graph.addEdge(Edge.when(cursor, nodeId, condition));
        return this;
    }

    public GraphBuilder addEdge(Edge edge) {
        checkNotBuilt();
        graph.addEdge(edge);
        return this;
    }

    // ── Build ─────────────────────────────────────────────────────────────────

    public Graph build() {
        checkNotBuilt();
        try {
            graph.validate();
        } catch (ValidationException e) {
            throw new ValidationException("graph validation failed: " + e.getMessage(), e);
        }
        List<String> unreachable = graph.findUnreachableNodes();
        if (!unreachable.isEmpty()) {
            log.warn("Graph {} has nodes unreachable from entry point {}: {}",
                    graph.getId(), graph.getEntryPoint(), unreachable);
        }
        graph.seal();
        built = true;
        log.debug("Built graph {} with {} nodes and {} edges", graph.getId(), graph.getNodeCount(), graph.getEdgeCount());
        return graph;
    }

    private void requireCursor() {
        checkNotBuilt();
        if (cursor == null) {
            throw new IllegalStateException("no current node: call addStartNode or from() before connecting");
        }
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("graph " + graph.getId() + " has already been built");
        }
    }
}
