package com.flowgraph.flowgraph_engine.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptTemplateRendererTest {

    private final PromptTemplateRenderer renderer = new PromptTemplateRenderer();

    @Test
    void resolvesNestedPathsAndListIndexes() {
        Map<String, Object> data = Map.of(
                "user", Map.of("name", "Ada", "langs", List.of("java", "go")),
                "count", 3);

        String out = renderer.render("Hi {{user.name}} ({{ .count }}), first: {{user.langs.0}}", data);

        assertThat(out).isEqualTo("Hi Ada (3), first: java");
    }

    @Test
    void structuredValuesRenderAsJson() {
        String out = renderer.render("ctx={{filters}}", Map.of("filters", Map.of("tier", "gold")));

        assertThat(out).isEqualTo("ctx={\"tier\":\"gold\"}");
    }

    @Test
    void missingAndNullValuesRenderEmptyByDefault() {
        Map<String, Object> data = new HashMap<>();
        data.put("nothing", null);

        assertThat(renderer.render("[{{absent}}][{{nothing}}]", data)).isEqualTo("[][]");
    }

    @Test
    void failPolicyRejectsUnresolvedPlaceholders() {
        PromptTemplateRenderer strict = new PromptTemplateRenderer(new ObjectMapper(), UnresolvedPlaceholderPolicy.FAIL);

        assertThatThrownBy(() -> strict.render("{{a.b}}", Map.of("a", Map.of())))
                .isInstanceOf(NotFoundException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NOT_FOUND)
                .hasMessageContaining("a.b");
    }

    @Test
    void replacementTextIsTakenLiterally() {
        assertThat(renderer.render("cost: {{price}}", Map.of("price", "$5\\n"))).isEqualTo("cost: $5\\n");
    }

    @Test
    void templateWithoutPlaceholdersIsUnchanged() {
        assertThat(renderer.render("plain text", Map.of())).isEqualTo("plain text");
    }
}
