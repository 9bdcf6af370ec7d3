package com.flowgraph.flowgraph_engine.model.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flowgraph.flowgraph_engine.exception.ErrorCode;
import com.flowgraph.flowgraph_engine.exception.FlowGraphException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Wire codec for {@link GraphState}. The document layout is the one produced by
 * {@link GraphState#toDocument()}.
 */
@Component
public class StateJsonCodec {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    @Autowired
    public StateJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public StateJsonCodec() {
        this(new ObjectMapper());
    }

    public String toJson(GraphState state) {
        try {
            return objectMapper.writeValueAsString(state.toDocument());
        } catch (JsonProcessingException e) {
            throw new FlowGraphException(ErrorCode.PERSISTENCE,
                    "failed to serialize state " + state.getId() + ": " + e.getOriginalMessage(), e);
        }
    }

    public GraphState fromJson(String json) {
        try {
            return GraphState.fromDocument(objectMapper.readValue(json, DOCUMENT));
        } catch (JsonProcessingException e) {
            throw new FlowGraphException(ErrorCode.PERSISTENCE,
                    "failed to deserialize state: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new FlowGraphException(ErrorCode.PERSISTENCE, "invalid state document: " + e.getMessage(), e);
        }
    }
}
