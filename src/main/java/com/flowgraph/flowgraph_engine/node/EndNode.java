package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.ExecutionCancelledException;
import com.flowgraph.flowgraph_engine.exception.FlowGraphException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;

/**
 * Exit node. A graph may have several. Only executed when the run is started
 * with {@code runExitNodes} or when the node is used as an ordinary hop.
 */
public class EndNode extends AbstractNode {

    public static final String META_EXECUTION_COMPLETED = "execution_completed";

    private final StateFinalizer finalizer;

    public EndNode(String id, String name, StateFinalizer finalizer) {
        super(id, name, NodeType.END, "Graph exit point");
        this.finalizer = finalizer;
    }

    public EndNode(String id, String name) {
        this(id, name, null);
    }

    @Override
    public GraphState execute(ExecutionContext ctx, GraphState state) {
        GraphState next = state.copy();
        if (finalizer != null) {
            try {
                finalizer.accept(ctx, next);
            } catch (FlowGraphException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutionCancelledException("finalizer of end node " + getId() + " interrupted");
            } catch (Exception e) {
                throw FlowGraphException.wrap("finalizer of end node " + getId() + " failed", e,
                        ErrorCode.NODE_EXECUTION);
            }
        }
        next.setMetadata(META_EXECUTION_COMPLETED, now());
        return next;
    }

    public boolean hasFinalizer() {
        return finalizer != null;
    }
}
