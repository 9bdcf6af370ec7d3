package com.flowgraph.flowgraph_engine.node.tool;

import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.llm.ToolSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public ToolRegistry() {}

    @Autowired
    public ToolRegistry(ObjectProvider<Tool> tools) {
        tools.orderedStream().forEach(this::register);
    }

    public ToolRegistry register(Tool tool) {
        if (tool == null || tool.getName() == null || tool.getName().isBlank()) {
            throw new ValidationException("tool must declare a name");
        }
        if (tools.put(tool.getName(), tool) != null) {
            log.warn("Tool '{}' registered twice, keeping the latest", tool.getName());
        }
        return this;
    }

    public Tool getTool(String name) {
        Tool tool = name != null ? tools.get(name) : null;
        if (tool == null) {
            throw new NotFoundException("tool not found: " + name);
        }
        return tool;
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<String> getToolNames() {
        List<String> names = new ArrayList<>(tools.keySet());
        names.sort(null);
        return names;
    }

    /** Specs for the given tool names, in the given order. Unknown names fail. */
    public List<ToolSpec> toolSpecs(Collection<String> names) {
        List<ToolSpec> specs = new ArrayList<>();
        if (names != null) {
            for (String name : names) {
                specs.add(ToolSpec.from(getTool(name)));
            }
        }
        return specs;
    }
}
