package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.condition.Condition;
import com.flowgraph.flowgraph_engine.condition.Conditions;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates a condition and records the outcome as a pair of mutually exclusive
 * flag keys. Branching itself is done by outgoing edges guarded with
 * {@link #whenTrue()} / {@link #whenFalse()}.
 */
@Getter
public class ConditionalNode extends AbstractNode {

    public static final String DEFAULT_TRUE_KEY = "condition_result_true";
    public static final String DEFAULT_FALSE_KEY = "condition_result_false";
    public static final String META_LAST_CONDITION_EVAL = "last_condition_eval";

    private final Condition condition;
    private final String trueKey;
    private final String falseKey;

    public ConditionalNode(String id, String name, Condition condition, String trueKey, String falseKey) {
        super(id, name, NodeType.CONDITIONAL, condition != null ? condition.getDescription() : null);
        this.condition = condition;
        this.trueKey = isBlank(trueKey) ? DEFAULT_TRUE_KEY : trueKey;
        this.falseKey = isBlank(falseKey) ? DEFAULT_FALSE_KEY : falseKey;
    }

    public ConditionalNode(String id, String name, Condition condition) {
        this(id, name, condition, null, null);
    }

    @Override
    public void validate() {
        super.validate();
        if (condition == null) {
            throw new ValidationException("conditional node " + getId() + " has no condition");
        }
        if (trueKey.equals(falseKey)) {
            throw new ValidationException("conditional node " + getId() + " uses the same key for both branches");
        }
    }

    @Override
    public GraphState execute(ExecutionContext ctx, GraphState state) {
        GraphState next = state.copy();
        boolean result = condition.evaluate(ctx, next);
        if (result) {
            next.set(trueKey, true);
            next.delete(falseKey);
        } else {
            next.set(falseKey, true);
            next.delete(trueKey);
        }

        Map<String, Object> eval = new LinkedHashMap<>();
        eval.put("node_id", getId());
        eval.put("condition", condition.getDescription());
        eval.put("result", result);
        eval.put("timestamp", now());
        next.setMetadata(META_LAST_CONDITION_EVAL, eval);
        return next;
    }

    /** Edge condition matching states where this node evaluated true. */
    public Condition whenTrue() {
        return Conditions.keyExists(trueKey);
    }

    public Condition whenFalse() {
        return Conditions.keyExists(falseKey);
    }
}
