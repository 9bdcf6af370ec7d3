package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import com.flowgraph.flowgraph_engine.node.tool.Tool;
import com.flowgraph.flowgraph_engine.node.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolNodeTest {

    private final ExecutionContext ctx = ExecutionContext.background();

    @Test
    void passesPresentInputsAndStoresResult() {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        List<Object> produced = new ArrayList<>(List.of("r1"));
        ToolRegistry tools = new ToolRegistry().register(Tool.of("search", "Searches", (c, input) -> {
            seen.set(input);
            return produced;
        }));
        ToolNode node = new ToolNode("t", "Search", "search", List.of("query", "limit"), "results", tools);
        GraphState state = new GraphState("s", "g");
        state.set("query", "graphs");

        GraphState result = node.execute(ctx, state);
        produced.add("mutated later");

        assertThat(seen.get()).containsOnlyKeys("query");
        assertThat(result.getList("results").orElseThrow()).containsExactly("r1");
        @SuppressWarnings("unchecked")
        Map<String, Object> call = (Map<String, Object>) result.getMetadata(ToolNode.META_LAST_TOOL_CALL).orElseThrow();
        assertThat(call).containsEntry("tool_name", "search").containsEntry("node_id", "t");
    }

    @Test
    void unknownToolFailsBeforeAnyWork() {
        ToolNode node = new ToolNode("t", "T", "missing", List.of(), "out", new ToolRegistry());

        assertThatThrownBy(() -> node.execute(ctx, new GraphState("s", "g")))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void toolFailureIsExternalCallError() {
        ToolRegistry tools = new ToolRegistry().register(Tool.of("flaky", null, (c, input) -> {
            throw new IllegalStateException("upstream 503");
        }));
        ToolNode node = new ToolNode("t", "T", "flaky", null, "out", tools);

        assertThatThrownBy(() -> node.execute(ctx, new GraphState("s", "g")))
                .hasFieldOrPropertyWithValue("code", ErrorCode.EXTERNAL_CALL)
                .hasMessage("tool flaky failed: upstream 503");
    }

    @Test
    void requiresRegistryAndNames() {
        assertThatThrownBy(() -> new ToolNode("t", "T", "x", null, "out", null).validate())
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new ToolNode("t", "T", "", null, "out", new ToolRegistry()).validate())
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void registryDescribesTools() {
        Tool weather = new Tool() {
            @Override
            public String getName() {
                return "weather";
            }

            @Override
            public Map<String, Object> getSchema() {
                Map<String, Object> schema = new LinkedHashMap<>();
                schema.put("type", "object");
                return schema;
            }

            @Override
            public Object execute(ExecutionContext ctx, Map<String, Object> input) {
                return "sunny";
            }
        };
        ToolRegistry tools = new ToolRegistry().register(weather);

        assertThat(tools.toolSpecs(List.of("weather")))
                .singleElement()
                .satisfies(spec -> {
                    assertThat(spec.name()).isEqualTo("weather");
                    assertThat(spec.description()).isEmpty();
                    assertThat(spec.parameters()).containsEntry("type", "object");
                });
        assertThatThrownBy(() -> tools.toolSpecs(List.of("nope"))).isInstanceOf(NotFoundException.class);
    }
}
