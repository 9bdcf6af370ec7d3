package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StartEndNodeTest {

    private final ExecutionContext ctx = ExecutionContext.background();

    @Test
    void startMergesInitialDataWithoutSharingIt() {
        Map<String, Object> seed = new HashMap<>();
        seed.put("items", new ArrayList<>(List.of("a")));
        StartNode start = new StartNode("start", "Start", seed);
        seed.put("late", true);

        GraphState first = start.execute(ctx, new GraphState("s", "g"));
        first.getList("items").orElseThrow().add("b");
        GraphState second = start.execute(ctx, new GraphState("s2", "g"));

        assertThat(first.has("late")).isFalse();
        assertThat(second.getList("items").orElseThrow()).containsExactly("a");
        assertThat(first.getMetadata(StartNode.META_EXECUTION_STARTED)).isPresent();
        assertThat(start.getType()).isEqualTo(NodeType.START);
    }

    @Test
    void endRunsFinalizerOnCopy() {
        EndNode end = new EndNode("end", "End", (c, s) -> s.set("done", true));
        GraphState input = new GraphState("s", "g");

        GraphState output = end.execute(ctx, input);

        assertThat(output.getBoolean("done")).contains(true);
        assertThat(input.has("done")).isFalse();
        assertThat(output.getMetadata(EndNode.META_EXECUTION_COMPLETED)).isPresent();
    }

    @Test
    void failingFinalizerIsNodeExecutionError() {
        EndNode end = new EndNode("end", "End", (c, s) -> {
            throw new IllegalStateException("cannot flush");
        });

        assertThatThrownBy(() -> end.execute(ctx, new GraphState("s", "g")))
                .hasFieldOrPropertyWithValue("code", ErrorCode.NODE_EXECUTION)
                .hasMessageContaining("cannot flush");
    }
}
