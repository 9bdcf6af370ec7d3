package com.flowgraph.flowgraph_engine.exception;

/**
 * Operands of a numeric or containment comparison have incompatible types.
 */
public class TypeCoercionException extends FlowGraphException {

    private static final long serialVersionUID = 1L;

    public TypeCoercionException(String message) {
        super(ErrorCode.TYPE_COERCION, message);
    }

    public TypeCoercionException(String message, Throwable cause) {
        super(ErrorCode.TYPE_COERCION, message, cause);
    }
}
