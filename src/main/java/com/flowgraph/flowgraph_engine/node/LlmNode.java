package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ExternalCallException;
import com.flowgraph.flowgraph_engine.exception.FlowGraphException;
import com.flowgraph.flowgraph_engine.exception.ExecutionCancelledException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.llm.LlmRequest;
import com.flowgraph.flowgraph_engine.model.llm.LlmResponse;
import com.flowgraph.flowgraph_engine.model.llm.ToolSpec;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import com.flowgraph.flowgraph_engine.node.llm.LlmClient;
import com.flowgraph.flowgraph_engine.node.llm.LlmClientRegistry;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a prompt from the state, sends it to a text-generation provider and
 * stores the reply text under {@code outputKey}.
 */
@Slf4j
@Getter
public class LlmNode extends AbstractNode {

    public static final String META_LAST_LLM_CALL = "last_llm_call";
    public static final int DEFAULT_MAX_TOKENS = 1000;
    public static final double DEFAULT_TEMPERATURE = 0.0;

    private final String provider;
    private final String model;
    private final String promptTemplate;
    private final String outputKey;
    private final int maxTokens;
    private final double temperature;
    private final String systemPrompt;
    private final List<ToolSpec> tools;

    private final LlmClientRegistry clients;
    private final PromptTemplateRenderer renderer;

    @Builder
    public LlmNode(String id, String name, String description,
                   String provider, String model, String promptTemplate, String outputKey,
                   Integer maxTokens, Double temperature, String systemPrompt, List<ToolSpec> tools,
                   LlmClientRegistry clients, PromptTemplateRenderer renderer) {
        super(id, name, NodeType.LLM, description);
        this.provider = provider;
        this.model = model;
        this.promptTemplate = promptTemplate;
        this.outputKey = outputKey;
        this.maxTokens = maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
        this.temperature = temperature != null ? temperature : DEFAULT_TEMPERATURE;
        this.systemPrompt = systemPrompt;
        this.tools = tools != null ? List.copyOf(tools) : List.of();
        this.clients = clients;
        this.renderer = renderer != null ? renderer : new PromptTemplateRenderer();
    }

    @Override
    public void validate() {
        super.validate();
        if (isBlank(provider))       throw new ValidationException("LLM node " + getId() + ": provider is required");
        if (isBlank(model))          throw new ValidationException("LLM node " + getId() + ": model is required");
        if (isBlank(promptTemplate)) throw new ValidationException("LLM node " + getId() + ": prompt template is required");
        if (isBlank(outputKey))      throw new ValidationException("LLM node " + getId() + ": output key is required");
        if (maxTokens <= 0) {
            throw new ValidationException("LLM node " + getId() + ": max tokens must be positive, got " + maxTokens);
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new ValidationException("LLM node " + getId() + ": temperature must be within [0, 2], got " + temperature);
        }
        if (clients == null) {
            throw new ValidationException("LLM node " + getId() + ": no LLM client registry bound");
        }
    }

    @Override
    public GraphState execute(ExecutionContext ctx, GraphState state) {
        if (clients == null) {
            throw new ValidationException("LLM node " + getId() + ": no LLM client registry bound");
        }
        LlmClient client = clients.getClient(provider);
        GraphState next = state.copy();

        String prompt = renderer.render(promptTemplate, next.snapshot());

        LlmRequest request = new LlmRequest(prompt, model);
        request.setSystemPrompt(systemPrompt);
        request.setMaxTokens(maxTokens);
        request.setTemperature(temperature);
        request.setTools(tools);
        request.setTimeout(ctx.remaining().orElse(null));

        log.debug("LLM node {} calling provider={} model={} promptChars={}", getId(), provider, model, prompt.length());
        LlmResponse response;
        try {
            response = client.call(request);
        } catch (FlowGraphException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("LLM call of node " + getId() + " interrupted");
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new ExternalCallException("LLM call to " + provider + " failed: " + msg, e);
        }
        if (response == null) {
            throw new ExternalCallException("LLM call to " + provider + " returned no response");
        }
        if (!response.isSuccess()) {
            throw new ExternalCallException("LLM call to " + provider + " failed: " + response.getErrorMessage());
        }

        String text = response.getText() != null ? response.getText() : "";
        next.set(outputKey, text);

        Map<String, Object> call = new LinkedHashMap<>();
        call.put("node_id", getId());
        call.put("provider", provider);
        call.put("model", response.getModel() != null ? response.getModel() : model);
        call.put("prompt", prompt);
        call.put("response", text);
        call.put("input_tokens", response.getInputTokens());
        call.put("output_tokens", response.getOutputTokens());
        call.put("timestamp", now());
        next.setMetadata(META_LAST_LLM_CALL, call);
        return next;
    }
}
