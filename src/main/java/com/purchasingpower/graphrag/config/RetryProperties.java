package com.purchasingpower.graphrag.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Exponential backoff used around embedding calls.
 *
 * <p>Delay before retry N (1-based) is {@code min(backoffMs * multiplier^(N-1), maxBackoffMs)}.
 */
@Data
public class RetryProperties {

    @Min(1)
    private int maxAttempts = 3;

    @Min(0)
    private long backoffMs = 200;

    @Min(0)
    private long maxBackoffMs = 2_000;

    @DecimalMin("1.0")
    private double multiplier = 2.0;

    public long delayBeforeRetry(int retryNumber) {
        double delay = backoffMs * Math.pow(multiplier, Math.max(0, retryNumber - 1));
        return (long) Math.min(delay, maxBackoffMs);
    }
}
