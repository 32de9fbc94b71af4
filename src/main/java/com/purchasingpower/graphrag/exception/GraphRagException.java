package com.purchasingpower.graphrag.exception;

/**
 * Base type of every error raised by the graph engine.
 *
 * @since 1.0.0
 */
public class GraphRagException extends RuntimeException {

    public GraphRagException(String message) {
        super(message);
    }

    public GraphRagException(String message, Throwable cause) {
        super(message, cause);
    }
}
