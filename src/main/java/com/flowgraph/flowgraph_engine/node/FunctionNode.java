package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.ExecutionCancelledException;
import com.flowgraph.flowgraph_engine.exception.FlowGraphException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

import java.util.LinkedHashMap;
import java.util.Map;

public class FunctionNode extends AbstractNode {

    public static final String META_LAST_FUNCTION_CALL = "last_function_call";

    private final StateTransform transform;

    public FunctionNode(String id, String name, String description, StateTransform transform) {
        super(id, name, NodeType.FUNCTION, description);
        this.transform = transform;
    }

    public FunctionNode(String id, String name, StateTransform transform) {
        this(id, name, null, transform);
    }

    @Override
    public void validate() {
        super.validate();
        if (transform == null) {
            throw new ValidationException("function node " + getId() + " has no transform");
        }
    }

    @Override
    public GraphState execute(ExecutionContext ctx, GraphState state) {
        if (transform == null) {
            throw new ValidationException("function node " + getId() + " has no transform");
        }
        GraphState result;
        try {
            result = transform.apply(ctx, state.copy());
        } catch (FlowGraphException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("function node " + getId() + " interrupted");
        } catch (Exception e) {
            throw FlowGraphException.wrap("function " + getName() + " failed", e, ErrorCode.NODE_EXECUTION);
        }
        if (result == null) {
            throw new FlowGraphException(ErrorCode.NODE_EXECUTION,
                    "function node " + getId() + " returned no state");
        }

        Map<String, Object> call = new LinkedHashMap<>();
        call.put("node_id", getId());
        call.put("function_name", getName());
        call.put("timestamp", now());
        result.setMetadata(META_LAST_FUNCTION_CALL, call);
        return result;
    }
}
