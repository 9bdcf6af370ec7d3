package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.exception.TypeCoercionException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateKeyConditionTest {

    private final ExecutionContext ctx = ExecutionContext.background();

    private GraphState stateWith(String key, Object value) {
        GraphState state = new GraphState("s", "g");
        state.set(key, value);
        return state;
    }

    @Test
    void greaterThanFortyByOperatorName() {
        Condition condition = Conditions.stateValue("number", 40, "greater");

        assertThat(condition.evaluate(ctx, stateWith("number", 42))).isTrue();
        assertThat(condition.evaluate(ctx, stateWith("number", 39))).isFalse();
        assertThat(condition.evaluate(ctx, new GraphState("s", "g"))).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
            "exists,false",
            "not_exists,true",
            "equals,false",
            "not_equals,true",
            "greater,false",
            "less,false",
            "contains,false"
    })
    void missingKeyNeverRaises(String operator, boolean expected) {
        Condition condition = Conditions.stateValue("absent", "x", operator);

        assertThat(condition.evaluate(ctx, new GraphState("s", "g"))).isEqualTo(expected);
    }

    @Test
    void unknownOperatorFailsAtConstruction() {
        assertThatThrownBy(() -> Conditions.stateValue("k", 1, "between"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("between");
    }

    @Test
    void equalsUsesStructuralEquality() {
        GraphState state = stateWith("cfg", Map.of("retries", 3L, "hosts", List.of("a", "b")));

        assertThat(Conditions.equalTo("cfg", Map.of("retries", 3, "hosts", List.of("a", "b"))).evaluate(ctx, state)).isTrue();
        assertThat(Conditions.notEqualTo("cfg", Map.of("retries", 4)).evaluate(ctx, state)).isTrue();
        assertThat(Conditions.equalTo("n", 5).evaluate(ctx, stateWith("n", 5.0))).isTrue();
    }

    @Test
    void numericComparisonCoercesNumericStrings() {
        assertThat(Conditions.lessThan("n", "10").evaluate(ctx, stateWith("n", "9.5"))).isTrue();
        assertThatThrownBy(() -> Conditions.greaterThan("n", 1).evaluate(ctx, stateWith("n", "many")))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    void containsCoversStringsSequencesAndMaps() {
        assertThat(Conditions.contains("s", "ell").evaluate(ctx, stateWith("s", "hello"))).isTrue();
        assertThat(Conditions.contains("xs", 2L).evaluate(ctx, stateWith("xs", List.of(1, 2, 3)))).isTrue();
        assertThat(Conditions.contains("xs", 9).evaluate(ctx, stateWith("xs", List.of(1, 2, 3)))).isFalse();
        assertThat(Conditions.contains("m", "k").evaluate(ctx, stateWith("m", Map.of("k", 1)))).isTrue();
    }

    @Test
    void containsRejectsMismatchedOperands() {
        assertThatThrownBy(() -> Conditions.contains("s", 1).evaluate(ctx, stateWith("s", "hello")))
                .isInstanceOf(TypeCoercionException.class);
        assertThatThrownBy(() -> Conditions.contains("m", 1).evaluate(ctx, stateWith("m", Map.of("k", 1))))
                .isInstanceOf(TypeCoercionException.class);
        assertThatThrownBy(() -> Conditions.contains("n", 1).evaluate(ctx, stateWith("n", 12)))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    void describesItself() {
        assertThat(Conditions.greaterThan("age", 40).getDescription()).isEqualTo("key 'age' greater 40");
        assertThat(Conditions.keyExists("user").getDescription()).isEqualTo("key 'user' exists");
    }
}
