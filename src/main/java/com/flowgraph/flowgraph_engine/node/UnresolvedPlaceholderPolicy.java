package com.flowgraph.flowgraph_engine.node;

/** What {@link PromptTemplateRenderer} does with a placeholder whose key is missing. */
public enum UnresolvedPlaceholderPolicy {

    /** Substitute an empty string and log a warning. */
    EMPTY,

    /** Throw {@link com.flowgraph.flowgraph_engine.exception.NotFoundException}. */
    FAIL
}
