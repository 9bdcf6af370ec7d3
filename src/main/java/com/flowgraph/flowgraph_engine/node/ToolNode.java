package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ExecutionCancelledException;
import com.flowgraph.flowgraph_engine.exception.ExternalCallException;
import com.flowgraph.flowgraph_engine.exception.FlowGraphException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import com.flowgraph.flowgraph_engine.model.state.StateValues;
import com.flowgraph.flowgraph_engine.node.tool.Tool;
import com.flowgraph.flowgraph_engine.node.tool.ToolRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invokes a named tool with selected payload entries and stores its result.
 * Input keys missing from the state are skipped.
 */
@Slf4j
@Getter
public class ToolNode extends AbstractNode {

    public static final String META_LAST_TOOL_CALL = "last_tool_call";

    private final String toolName;
    private final List<String> inputKeys;
    private final String outputKey;
    private final ToolRegistry tools;

    public ToolNode(String id, String name, String toolName, List<String> inputKeys, String outputKey, ToolRegistry tools) {
        super(id, name, NodeType.TOOL, null);
        this.toolName = toolName;
        this.inputKeys = inputKeys != null ? List.copyOf(inputKeys) : List.of();
        this.outputKey = outputKey;
        this.tools = tools;
    }

    @Override
    public void validate() {
        super.validate();
        if (isBlank(toolName))  throw new ValidationException("tool node " + getId() + ": tool name is required");
        if (isBlank(outputKey)) throw new ValidationException("tool node " + getId() + ": output key is required");
        if (tools == null)      throw new ValidationException("tool node " + getId() + ": no tool registry bound");
    }

    @Override
    public GraphState execute(ExecutionContext ctx, GraphState state) {
        if (tools == null) {
            throw new ValidationException("tool node " + getId() + ": no tool registry bound");
        }
        Tool tool = tools.getTool(toolName);
        GraphState next = state.copy();

        Map<String, Object> input = new LinkedHashMap<>();
        for (String key : inputKeys) {
            if (next.has(key)) {
                input.put(key, StateValues.deepCopy(next.get(key).orElse(null)));
            }
        }

        log.debug("Tool node {} invoking tool={} inputs={}", getId(), toolName, input.keySet());
        Object result;
        try {
            result = tool.execute(ctx, StateValues.deepCopyMap(input));
        } catch (FlowGraphException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("tool " + toolName + " interrupted");
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new ExternalCallException("tool " + toolName + " failed: " + msg, e);
        }

        next.set(outputKey, StateValues.deepCopy(result));

        Map<String, Object> call = new LinkedHashMap<>();
        call.put("node_id", getId());
        call.put("tool_name", toolName);
        call.put("inputs", input);
        call.put("result", StateValues.deepCopy(result));
        call.put("timestamp", now());
        next.setMetadata(META_LAST_TOOL_CALL, call);
        return next;
    }
}
