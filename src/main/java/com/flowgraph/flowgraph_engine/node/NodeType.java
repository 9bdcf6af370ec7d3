package com.flowgraph.flowgraph_engine.node;

import lombok.Getter;

@Getter
public enum NodeType {

    START("start"),
    END("end"),
    LLM("llm"),
    TOOL("tool"),
    FUNCTION("function"),
    CONDITIONAL("conditional");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }
}
