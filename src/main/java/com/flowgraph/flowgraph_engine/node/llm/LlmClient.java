package com.flowgraph.flowgraph_engine.node.llm;

import com.flowgraph.flowgraph_engine.model.llm.LlmRequest;
import com.flowgraph.flowgraph_engine.model.llm.LlmResponse;

/**
 * A text-generation provider. Declare implementations as Spring beans and they
 * are picked up by {@link LlmClientRegistry}.
 */
public interface LlmClient {

    // Provider name, matched case-insensitively
    String getProvider();

    LlmResponse call(LlmRequest request) throws Exception;
}
