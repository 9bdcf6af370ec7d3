package com.flowgraph.flowgraph_engine.model.llm;

import com.flowgraph.flowgraph_engine.node.tool.Tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Description of a tool handed to a text-generation provider alongside the prompt.
 */
public record ToolSpec(String name, String description, Map<String, Object> parameters) {

    public ToolSpec {
        description = description != null ? description : "";
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    public static ToolSpec from(Tool tool) {
        return new ToolSpec(tool.getName(), tool.getDescription(), tool.getSchema());
    }
}
