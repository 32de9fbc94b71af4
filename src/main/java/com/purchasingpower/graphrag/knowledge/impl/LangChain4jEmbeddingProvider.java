package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.exception.EmbeddingUnavailableException;
import com.purchasingpower.graphrag.knowledge.EmbeddingProvider;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LangChain4j-backed embedding provider talking to a local Ollama server.
 *
 * <p>Retries are left to {@link GuardedEmbeddingClient}, so the underlying
 * client is built with a single attempt.
 *
 * @since 1.0.0
 */
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final int dimension;

    public LangChain4jEmbeddingProvider(String baseUrl, String modelName, int dimension, Duration timeout) {
        log.info("🔷 Initializing LangChain4j embedding provider");
        log.info("   - Ollama URL: {}", baseUrl);
        log.info("   - Model: {}", modelName);
        log.info("   - Dimension: {}", dimension);

        this.embeddingModel = OllamaEmbeddingModel.builder()
            .baseUrl(baseUrl)
            .modelName(modelName)
            .timeout(timeout)
            .maxRetries(1)
            .logRequests(false)
            .logResponses(false)
            .build();
        this.modelName = modelName;
        this.dimension = dimension;
    }

    LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel, String modelName, int dimension) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.dimension = dimension;
    }

    @Override
    public EmbeddingVector embed(String text) {
        Response<Embedding> response = embeddingModel.embed(text);
        return toVector(response.content());
    }

    @Override
    public List<EmbeddingVector> embedBatch(List<String> texts) {
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
        Response<List<Embedding>> response = embeddingModel.embedAll(segments);
        List<Embedding> embeddings = response.content();
        if (embeddings.size() != texts.size()) {
            throw new EmbeddingUnavailableException("Provider returned " + embeddings.size()
                + " embeddings for " + texts.size() + " texts");
        }
        List<EmbeddingVector> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            vectors.add(toVector(embedding));
        }
        log.debug("✅ Generated {} embeddings", vectors.size());
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelId() {
        return "ollama:" + modelName;
    }

    private EmbeddingVector toVector(Embedding embedding) {
        float[] values = embedding.vector();
        if (values.length != dimension) {
            throw new EmbeddingUnavailableException("Model " + modelName + " returned dimension "
                + values.length + ", configured " + dimension);
        }
        return new EmbeddingVector(values, modelId());
    }
}
