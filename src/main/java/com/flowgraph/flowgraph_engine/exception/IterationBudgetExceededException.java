package com.flowgraph.flowgraph_engine.exception;

import lombok.Getter;

/**
 * The hop counter of a run reached its cap before the graph terminated.
 */
@Getter
public class IterationBudgetExceededException extends FlowGraphException {

    private static final long serialVersionUID = 1L;

    private final int maxIterations;

    public IterationBudgetExceededException(int maxIterations) {
        super(ErrorCode.ITERATION_BUDGET_EXCEEDED,
                "maximum iterations (" + maxIterations + ") reached, possible infinite loop");
        this.maxIterations = maxIterations;
    }
}
