package com.flowgraph.flowgraph_engine.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.flowgraph_engine.config.GraphEngineProperties;
import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{key}}} and {@code {{key.nested.0.field}}} placeholders with
 * values from a state payload. A leading dot ({@code {{.key}}}) is accepted too.
 * Maps and lists render as JSON, null renders as an empty string.
 */
@Slf4j
@Component
public class PromptTemplateRenderer {

    // Matches {{key}}, {{ key.path }}, {{.key}}
    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{\\s*\\.?([A-Za-z0-9_.\\-]+)\\s*}}");

    private final ObjectMapper objectMapper;
    private final UnresolvedPlaceholderPolicy policy;

    public PromptTemplateRenderer(ObjectMapper objectMapper, UnresolvedPlaceholderPolicy policy) {
        this.objectMapper = objectMapper;
        this.policy = policy != null ? policy : UnresolvedPlaceholderPolicy.EMPTY;
    }

    @Autowired
    public PromptTemplateRenderer(ObjectMapper objectMapper, GraphEngineProperties properties) {
        this(objectMapper, properties.getTemplate().getUnresolvedPlaceholder());
    }

    public PromptTemplateRenderer() {
        this(new ObjectMapper(), UnresolvedPlaceholderPolicy.EMPTY);
    }

    public String render(String template, Map<String, Object> data) {
        if (template == null || !template.contains("{{")) return template;

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String path = matcher.group(1);
            Resolved value = resolvePath(path, data);
            String replacement;
            if (!value.found()) {
                if (policy == UnresolvedPlaceholderPolicy.FAIL) {
                    throw new NotFoundException("template placeholder {{" + path + "}} does not resolve");
                }
                log.warn("Template placeholder {{{}}} did not resolve, substituting empty string", path);
                replacement = "";
            } else {
                replacement = stringify(value.value());
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public UnresolvedPlaceholderPolicy getPolicy() {
        return policy;
    }

    // Walks maps by key and lists by index
    private Resolved resolvePath(String path, Map<String, Object> data) {
        Object current = data;
        for (String part : path.split("\\.")) {
            if (part.isEmpty()) return Resolved.MISSING;
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(part)) return Resolved.MISSING;
                current = map.get(part);
            } else if (current instanceof List<?> list) {
                int index;
                try {
                    index = Integer.parseInt(part);
                } catch (NumberFormatException e) {
                    return Resolved.MISSING;
                }
                if (index < 0 || index >= list.size()) return Resolved.MISSING;
                current = list.get(index);
            } else {
                return Resolved.MISSING;
            }
        }
        return new Resolved(true, current);
    }

    private String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s;
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                log.warn("Could not render structured value as JSON: {}", e.getOriginalMessage());
                return value.toString();
            }
        }
        return value.toString();
    }

    private record Resolved(boolean found, Object value) {
        static final Resolved MISSING = new Resolved(false, null);
    }
}
