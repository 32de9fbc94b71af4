package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.GraphFixtures;
import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.exception.EmbeddingUnavailableException;
import com.purchasingpower.graphrag.knowledge.EmbeddingProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Guarded Embedding Client Tests")
class GuardedEmbeddingClientTest {

    private final GraphRagProperties properties = GraphFixtures.properties();

    @Test
    @DisplayName("Should give up on a stalled provider after the caller deadline")
    void testQueryTimeout() {
        // Given: A provider that stalls for longer than the deadline
        GuardedEmbeddingClient client = new GuardedEmbeddingClient(
            GraphFixtures.failingProvider(Duration.ofSeconds(2)), GraphFixtures.executor(), properties);

        // When
        long start = System.currentTimeMillis();
        EmbeddingUnavailableException e = assertThrows(EmbeddingUnavailableException.class,
            () -> client.embedQuery("send a chat message", Duration.ofMillis(100)));

        // Then: The caller got control back well before the provider finished
        assertThat(System.currentTimeMillis() - start).isLessThan(1500);
        assertThat(e.getMessage()).contains("timed out");
    }

    @Test
    @DisplayName("Should report a saturated pool as an unavailable embedding")
    void testSaturatedPool() {
        // Given: One worker and one queue slot, both held by a provider that ignores cancellation
        CountDownLatch release = new CountDownLatch(1);
        ThreadPoolTaskExecutor executor = GraphFixtures.boundedExecutor(1, 1);
        GuardedEmbeddingClient client = new GuardedEmbeddingClient(
            GraphFixtures.stuckProvider(release), executor, properties);
        List<String> messages = new ArrayList<>();

        try {
            // When
            for (int i = 0; i < 4; i++) {
                EmbeddingUnavailableException e = assertThrows(EmbeddingUnavailableException.class,
                    () -> client.embedQuery("send a chat message", Duration.ofMillis(50)));
                messages.add(e.getMessage());
            }
        } finally {
            release.countDown();
            executor.shutdown();
        }

        // Then: Early calls time out, later ones are refused by the pool
        assertThat(messages.get(0)).contains("timed out");
        assertThat(messages.get(3)).contains("saturated");
    }

    @Test
    @DisplayName("Should retry build calls with backoff and succeed on a later attempt")
    void testBuildRetrySucceeds() {
        // Given: A provider that fails once, then works
        HashingEmbeddingProvider delegate = new HashingEmbeddingProvider(GraphFixtures.DIMENSION);
        AtomicInteger calls = new AtomicInteger();
        EmbeddingProvider flaky = mock(EmbeddingProvider.class);
        when(flaky.dimension()).thenReturn(GraphFixtures.DIMENSION);
        when(flaky.embed(anyString())).thenAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
            }
            return delegate.embed(invocation.getArgument(0));
        });
        GuardedEmbeddingClient client = new GuardedEmbeddingClient(flaky, GraphFixtures.executor(), properties);

        // When
        EmbeddingVector vector = client.embedForBuild("slack");

        // Then
        assertThat(vector).isEqualTo(delegate.embed("slack"));
        verify(flaky, times(2)).embed("slack");
    }

    @Test
    @DisplayName("Should surface provider failures after the configured attempts")
    void testBuildRetryExhausted() {
        EmbeddingProvider broken = mock(EmbeddingProvider.class);
        when(broken.dimension()).thenReturn(GraphFixtures.DIMENSION);
        when(broken.embedBatch(List.of("a", "b"))).thenThrow(new IllegalStateException("down"));
        GuardedEmbeddingClient client = new GuardedEmbeddingClient(broken, GraphFixtures.executor(), properties);

        EmbeddingUnavailableException e = assertThrows(EmbeddingUnavailableException.class,
            () -> client.embedBatchForBuild(List.of("a", "b")));

        assertThat(e.getMessage()).contains("down");
        verify(broken, times(properties.getRetry().getMaxAttempts())).embedBatch(List.of("a", "b"));
    }

    @Test
    @DisplayName("Should reject vectors whose dimension differs from the provider's")
    void testDimensionChecked() {
        EmbeddingProvider lying = mock(EmbeddingProvider.class);
        when(lying.dimension()).thenReturn(GraphFixtures.DIMENSION);
        when(lying.embed("slack")).thenReturn(new EmbeddingVector(new float[3], "lying"));
        GuardedEmbeddingClient client = new GuardedEmbeddingClient(lying, GraphFixtures.executor(), properties);

        assertThrows(EmbeddingUnavailableException.class, () -> client.embedQuery("slack", null));
        assertEquals(1, properties.getQuery().getEmbeddingAttempts());
    }
}
