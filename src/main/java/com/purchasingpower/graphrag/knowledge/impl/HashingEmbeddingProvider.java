package com.purchasingpower.graphrag.knowledge.impl;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.knowledge.EmbeddingProvider;
import com.purchasingpower.graphrag.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic in-process embedding based on signed feature hashing.
 *
 * <p>Each token contributes to one bucket, as do its leading characters, so
 * inflections like "message"/"messages" land close together. Vectors are
 * L2-normalised; text without tokens maps to the zero vector.
 *
 * @since 1.0.0
 */
@Slf4j
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final int PREFIX_LENGTH = 5;
    private static final float PREFIX_WEIGHT = 0.5f;

    private final int dimension;
    private final String modelId;
    private final HashFunction hash = Hashing.murmur3_32_fixed();

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.modelId = "hashing-v1-" + dimension;
        log.info("🔷 Hashing embedding provider ready (dimension={})", dimension);
    }

    @Override
    public EmbeddingVector embed(String text) {
        float[] values = new float[dimension];
        for (String token : TextUtils.tokenize(text)) {
            add(values, token, 1.0f);
            if (token.length() > PREFIX_LENGTH) {
                add(values, "#" + token.substring(0, PREFIX_LENGTH), PREFIX_WEIGHT);
            }
        }
        normalize(values);
        return new EmbeddingVector(values, modelId);
    }

    @Override
    public List<EmbeddingVector> embedBatch(List<String> texts) {
        List<EmbeddingVector> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelId() {
        return modelId;
    }

    private void add(float[] values, String feature, float weight) {
        int h = hash.hashString(feature, StandardCharsets.UTF_8).asInt();
        int bucket = Math.floorMod(h, dimension);
        // top bit chooses the sign so collisions tend to cancel
        float sign = (h >>> 31) == 0 ? 1f : -1f;
        values[bucket] += sign * weight;
    }

    private static void normalize(float[] values) {
        double sum = 0;
        for (float v : values) {
            sum += (double) v * v;
        }
        if (sum == 0) {
            return;
        }
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < values.length; i++) {
            values[i] /= norm;
        }
    }
}
