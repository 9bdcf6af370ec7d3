package com.flowgraph.flowgraph_engine.condition;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.ExecutionCancelledException;
import com.flowgraph.flowgraph_engine.exception.FlowGraphException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

public class CustomCondition implements Condition {

    private final StatePredicate predicate;
    private final String description;

    public CustomCondition(StatePredicate predicate, String description) {
        if (predicate == null) {
            throw new ValidationException("custom condition needs a predicate");
        }
        this.predicate = predicate;
        this.description = description != null && !description.isBlank() ? description : "custom condition";
    }

    @Override
    public boolean evaluate(ExecutionContext ctx, GraphState state) {
        try {
            return predicate.test(ctx, state);
        } catch (FlowGraphException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("custom condition '" + description + "' interrupted");
        } catch (Exception e) {
            throw FlowGraphException.wrap("custom condition '" + description + "' failed", e,
                    ErrorCode.CONDITION_EVALUATION);
        }
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
