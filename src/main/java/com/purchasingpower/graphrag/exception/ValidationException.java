package com.purchasingpower.graphrag.exception;

/**
 * Malformed input: blank query text, bad weights, out-of-range strength, wrong vector dimension.
 * Never retried.
 */
public class ValidationException extends GraphRagException {

    public ValidationException(String message) {
        super(message);
    }
}
