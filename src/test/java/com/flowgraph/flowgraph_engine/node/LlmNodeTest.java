package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.ExternalCallException;
import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import com.flowgraph.flowgraph_engine.model.execution.ExecutionContext;
import com.flowgraph.flowgraph_engine.model.llm.LlmRequest;
import com.flowgraph.flowgraph_engine.model.llm.LlmResponse;
import com.flowgraph.flowgraph_engine.model.llm.ToolSpec;
import com.flowgraph.flowgraph_engine.model.state.GraphState;
import com.flowgraph.flowgraph_engine.node.llm.LlmClient;
import com.flowgraph.flowgraph_engine.node.llm.LlmClientRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmNodeTest {

    @Mock
    private LlmClient client;

    private LlmClientRegistry registry;

    @BeforeEach
    void setUp() {
        when(client.getProvider()).thenReturn("Mock");
        registry = new LlmClientRegistry().register(client);
    }

    private LlmNode.LlmNodeBuilder node() {
        return LlmNode.builder()
                .id("summarize").name("Summarize")
                .provider("mock").model("m-1")
                .promptTemplate("Summarize {{doc.title}} for {{user}}")
                .outputKey("summary")
                .clients(registry);
    }

    @Test
    void rendersPromptCallsClientAndStoresText() throws Exception {
        when(client.call(any())).thenReturn(LlmResponse.ok("short summary", "m-1-2024", 12, 3));
        GraphState state = new GraphState("s", "g");
        state.set("doc", Map.of("title", "Report"));
        state.set("user", "ada");

        GraphState result = node().systemPrompt("be brief").build()
                .execute(ExecutionContext.background().withTimeout(Duration.ofMinutes(1)), state);

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(client).call(request.capture());
        assertThat(request.getValue().getPrompt()).isEqualTo("Summarize Report for ada");
        assertThat(request.getValue().getSystemPrompt()).isEqualTo("be brief");
        assertThat(request.getValue().getMaxTokens()).isEqualTo(LlmNode.DEFAULT_MAX_TOKENS);
        assertThat(request.getValue().getTimeout()).isNotNull().isLessThanOrEqualTo(Duration.ofMinutes(1));

        assertThat(result.getString("summary")).contains("short summary");
        assertThat(state.has("summary")).isFalse();
        @SuppressWarnings("unchecked")
        Map<String, Object> call = (Map<String, Object>) result.getMetadata(LlmNode.META_LAST_LLM_CALL).orElseThrow();
        assertThat(call)
                .containsEntry("node_id", "summarize")
                .containsEntry("provider", "mock")
                .containsEntry("model", "m-1-2024")
                .containsEntry("input_tokens", 12)
                .containsEntry("output_tokens", 3);
    }

    @Test
    void passesToolSpecsThrough() throws Exception {
        when(client.call(any())).thenReturn(LlmResponse.ok("ok", "m-1"));
        ToolSpec spec = new ToolSpec("lookup", "Finds things", Map.of("type", "object"));

        node().tools(List.of(spec)).build().execute(ExecutionContext.background(), new GraphState("s", "g"));

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(client).call(request.capture());
        assertThat(request.getValue().getTools()).containsExactly(spec);
        assertThat(request.getValue().getTimeout()).isNull();
    }

    @Test
    void unsuccessfulResponseIsExternalCallError() throws Exception {
        when(client.call(any())).thenReturn(LlmResponse.error("rate limited"));

        assertThatThrownBy(() -> node().build().execute(ExecutionContext.background(), new GraphState("s", "g")))
                .isInstanceOf(ExternalCallException.class)
                .hasMessageContaining("rate limited");
    }

    @Test
    void thrownClientErrorIsExternalCallError() throws Exception {
        when(client.call(any())).thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> node().build().execute(ExecutionContext.background(), new GraphState("s", "g")))
                .hasFieldOrPropertyWithValue("code", ErrorCode.EXTERNAL_CALL)
                .hasMessageContaining("connection reset");
    }

    @Test
    void unknownProviderIsNotFound() throws Exception {
        LlmNode node = node().provider("other").build();

        assertThatThrownBy(() -> node.execute(ExecutionContext.background(), new GraphState("s", "g")))
                .isInstanceOf(NotFoundException.class);
        verify(client, never()).call(any());
    }

    @Test
    void validatesConfiguration() {
        node().build().validate();

        assertThatThrownBy(() -> node().maxTokens(0).build().validate()).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> node().temperature(2.5).build().validate()).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> node().outputKey("").build().validate()).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> node().clients(null).build().validate())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("registry");
    }
}
