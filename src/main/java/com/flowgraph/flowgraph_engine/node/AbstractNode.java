package com.flowgraph.flowgraph_engine.node;

import com.flowgraph.flowgraph_engine.exception.ValidationException;
import lombok.Getter;

import java.time.Instant;

/**
 * Identity shared by every node variant.
 */
@Getter
public abstract class AbstractNode implements Node {

    private final String id;
    private final String name;
    private final NodeType type;
    private final String description;

    protected AbstractNode(String id, String name, NodeType type, String description) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.description = description != null ? description : "";
    }

    @Override
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new ValidationException("node id must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("node name must not be blank");
        }
    }

    // Metadata timestamps stay JSON-representable
    protected static String now() {
        return Instant.now().toString();
    }

    protected static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', name='" + name + "'}";
    }
}
