package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Hashing Embedding Provider Tests")
class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider(64);

    @Test
    @DisplayName("Should produce identical unit vectors for identical text")
    void testDeterministicAndNormalised() {
        EmbeddingVector first = provider.embed("Send a chat message to Slack");
        EmbeddingVector second = new HashingEmbeddingProvider(64).embed("Send a chat message to Slack");

        assertThat(first).isEqualTo(second);
        assertEquals(64, first.dimension());
        assertEquals("hashing-v1-64", first.modelId());
        assertThat(first.cosine(first)).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Should place related wording closer than unrelated wording")
    void testRelatedTextIsCloser() {
        EmbeddingVector chat = provider.embed("send chat messages to a channel");
        EmbeddingVector similar = provider.embed("send a chat message");
        EmbeddingVector unrelated = provider.embed("postgres database query");

        assertThat(chat.cosine(similar)).isGreaterThan(chat.cosine(unrelated));
    }

    @Test
    @DisplayName("Should map text without tokens to the zero vector")
    void testEmptyText() {
        EmbeddingVector empty = provider.embed("  ");

        assertEquals(64, empty.dimension());
        assertThat(empty.cosine(provider.embed("slack"))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should embed batches in input order")
    void testBatchOrder() {
        List<EmbeddingVector> batch = provider.embedBatch(List.of("slack", "discord"));

        assertThat(batch).containsExactly(provider.embed("slack"), provider.embed("discord"));
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddingProvider(0));
    }
}
