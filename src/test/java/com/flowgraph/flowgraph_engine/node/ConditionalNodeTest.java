package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.condition.Conditions;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;


import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionalNodeTest {

    private final ExecutionContext ctx = ExecutionContext.background();

    @Test
    void flagsAreMutuallyExclusiveAcrossEvaluations() {
        ConditionalNode node = new ConditionalNode("check", "Check", Conditions.greaterThan("score", 50));
        GraphState state = new GraphState("s", "g");
        state.set("score", 80);

        GraphState high = node.execute(ctx, state);
        assertThat(high.getBoolean(ConditionalNode.DEFAULT_TRUE_KEY)).contains(true);
        assertThat(high.has(ConditionalNode.DEFAULT_FALSE_KEY)).isFalse();
        assertThat(node.whenTrue().evaluate(ctx, high)).isTrue();
        assertThat(node.whenFalse().evaluate(ctx, high)).isFalse();

        high.set("score", 10);
        GraphState low = node.execute(ctx, high);
        assertThat(low.has(ConditionalNode.DEFAULT_TRUE_KEY)).isFalse();
        assertThat(low.getBoolean(ConditionalNode.DEFAULT_FALSE_KEY)).contains(true);
        assertThat(node.whenFalse().evaluate(ctx, low)).isTrue();
    }

    @Test
    void customFlagKeysAndMetadata() {
        ConditionalNode node = new ConditionalNode("c", "C", Conditions.keyExists("user"), "has_user", "no_user");

        GraphState result = node.execute(ctx, new GraphState("s", "g"));

        assertThat(result.getBoolean("no_user")).contains(true);
        assertThat(result.getMetadata(ConditionalNode.META_LAST_CONDITION_EVAL))
                .get().asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("result", false)
                .containsEntry("condition", "key 'user' exists");
    }

    @Test
    void requiresCondition() {
        assertThatThrownBy(() -> new ConditionalNode("c", "C", null).validate())
                .isInstanceOf(ValidationException.class);
    }
}
