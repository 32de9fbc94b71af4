package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.config.RetryProperties;
import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.exception.EmbeddingUnavailableException;
import com.purchasingpower.graphrag.knowledge.EmbeddingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs embedding calls on a bounded pool with a timeout and exponential backoff.
 *
 * <p>The query path normally gets one short attempt so that a slow provider
 * degrades the query instead of stalling it; the build path uses the full
 * retry policy.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class GuardedEmbeddingClient {

    private final EmbeddingProvider provider;
    private final AsyncTaskExecutor executor;
    private final GraphRagProperties properties;

    public GuardedEmbeddingClient(EmbeddingProvider provider,
                                  @Qualifier("embeddingExecutor") AsyncTaskExecutor executor,
                                  GraphRagProperties properties) {
        this.provider = provider;
        this.executor = executor;
        this.properties = properties;
    }

    public EmbeddingProvider provider() {
        return provider;
    }

    /**
     * Embed query text within the caller's time budget.
     *
     * @param timeout upper bound for each attempt; the configured query timeout applies when null
     * @throws EmbeddingUnavailableException when no vector arrives within the configured attempts
     */
    public EmbeddingVector embedQuery(String text, Duration timeout) {
        Duration budget = timeout != null ? timeout : properties.getEmbedding().getQueryTimeout();
        int attempts = properties.getQuery().getEmbeddingAttempts();
        EmbeddingVector vector = withRetry("query", attempts, budget, () -> provider.embed(text));
        checkDimension(vector);
        return vector;
    }

    /**
     * Embed a batch for the build, retrying the whole batch with backoff.
     */
    public List<EmbeddingVector> embedBatchForBuild(List<String> texts) {
        List<EmbeddingVector> vectors = withRetry("batch of " + texts.size(),
            properties.getRetry().getMaxAttempts(),
            properties.getEmbedding().getBuildTimeout(),
            () -> provider.embedBatch(texts));
        if (vectors.size() != texts.size()) {
            throw new EmbeddingUnavailableException("Expected " + texts.size() + " vectors, got " + vectors.size());
        }
        vectors.forEach(this::checkDimension);
        return vectors;
    }

    /**
     * Embed one text for the build with the full retry policy.
     */
    public EmbeddingVector embedForBuild(String text) {
        EmbeddingVector vector = withRetry("single text",
            properties.getRetry().getMaxAttempts(),
            properties.getEmbedding().getBuildTimeout(),
            () -> provider.embed(text));
        checkDimension(vector);
        return vector;
    }

    private <T> T withRetry(String what, int maxAttempts, Duration timeout, Callable<T> call) {
        RetryProperties retry = properties.getRetry();
        EmbeddingUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return callWithTimeout(call, timeout);
            } catch (EmbeddingUnavailableException e) {
                last = e;
                if (attempt < maxAttempts) {
                    long delay = retry.delayBeforeRetry(attempt);
                    log.warn("⚠️ Embedding {} failed (attempt {}/{}), retrying in {}ms: {}",
                        what, attempt, maxAttempts, delay, e.getMessage());
                    sleep(delay);
                }
            }
        }
        log.error("❌ Embedding {} failed after {} attempt(s)", what, maxAttempts);
        throw last;
    }

    private <T> T callWithTimeout(Callable<T> call, Duration timeout) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new EmbeddingUnavailableException("Embedding pool saturated: " + e.getMessage(), e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingUnavailableException("Embedding timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof EmbeddingUnavailableException unavailable) {
                throw unavailable;
            }
            throw new EmbeddingUnavailableException("Embedding provider failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted while waiting for embedding", e);
        }
    }

    private void checkDimension(EmbeddingVector vector) {
        if (vector == null) {
            throw new EmbeddingUnavailableException("Provider returned no vector");
        }
        if (vector.dimension() != provider.dimension()) {
            throw new EmbeddingUnavailableException("Provider returned dimension " + vector.dimension()
                + ", expected " + provider.dimension());
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted during embedding backoff", e);
        }
    }
}
