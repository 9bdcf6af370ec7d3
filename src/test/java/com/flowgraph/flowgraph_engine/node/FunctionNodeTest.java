package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.FlowGraphException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunctionNodeTest {

    private final ExecutionContext ctx = ExecutionContext.background();

    @Test
    void transformRunsOnCopyAndRecordsCall() {
        FunctionNode node = new FunctionNode("inc", "Increment", (c, s) -> {
            s.set("counter", s.getInteger("counter").orElse(0) + 1);
            return s;
        });
        GraphState input = new GraphState("s", "g");
        input.set("counter", 0);

        GraphState output = node.execute(ctx, input);

        assertThat(output.getInteger("counter")).contains(1);
        assertThat(input.getInteger("counter")).contains(0);
        assertThat(output.getMetadata(FunctionNode.META_LAST_FUNCTION_CALL))
                .get().asInstanceOf(InstanceOfAssertFactories.MAP).containsEntry("node_id", "inc");
    }

    @Test
    void missingTransformIsInvalid() {
        FunctionNode node = new FunctionNode("f", "F", null);

        assertThatThrownBy(node::validate).isInstanceOf(ValidationException.class);
    }

    @Test
    void nullResultIsExecutionError() {
        FunctionNode node = new FunctionNode("f", "F", (c, s) -> null);

        assertThatThrownBy(() -> node.execute(ctx, new GraphState("s", "g")))
                .isInstanceOf(FlowGraphException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NODE_EXECUTION);
    }

    @Test
    void checkedExceptionIsWrapped() {
        FunctionNode node = new FunctionNode("f", "Parse", (c, s) -> {
            throw new IOException("bad input");
        });

        assertThatThrownBy(() -> node.execute(ctx, new GraphState("s", "g")))
                .hasFieldOrPropertyWithValue("code", ErrorCode.NODE_EXECUTION)
                .hasMessage("function Parse failed: bad input");
    }

    @Test
    void blankIdentityIsInvalid() {
        assertThatThrownBy(() -> new FunctionNode(" ", "F", (c, s) -> s).validate())
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new FunctionNode("f", "", (c, s) -> s).validate())
                .isInstanceOf(ValidationException.class);
    }
}
