package com.purchasingpower.graphrag.exception;

/**
 * The embedding provider timed out or failed after its retries.
 * The query engine converts this into a degraded keyword-only response.
 *
 * @since 1.0.0
 */
public class EmbeddingUnavailableException extends GraphRagException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
