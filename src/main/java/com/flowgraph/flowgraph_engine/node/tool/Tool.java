package com.flowgraph.flowgraph_engine.node.tool;

import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;

import java.util.Map;

/**
 * A named capability a {@code ToolNode} can invoke. Declare implementations as
 * Spring beans to have them registered in {@link ToolRegistry}.
 */
public interface Tool {

    String getName();

    default String getDescription() {
        return "";
    }

    /** JSON-schema-like description of the accepted input. */
    default Map<String, Object> getSchema() {
        return Map.of();
    }

    Object execute(ExecutionContext ctx, Map<String, Object> input) throws Exception;

    @FunctionalInterface
    interface Handler {
        Object handle(ExecutionContext ctx, Map<String, Object> input) throws Exception;
    }

    /** Adapts a lambda into a tool. */
    static Tool of(String name, String description, Handler handler) {
        return new Tool() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String getDescription() {
                return description != null ? description : "";
            }

            @Override
            public Object execute(ExecutionContext ctx, Map<String, Object> input) throws Exception {
                return handler.handle(ctx, input);
            }

            @Override
            public String toString() {
                return "Tool{" + name + "}";
            }
        };
    }
}
