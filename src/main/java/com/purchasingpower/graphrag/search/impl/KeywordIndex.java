package com.purchasingpower.graphrag.search.impl;

import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.MetadataKeys;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.util.TextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * BM25 index over one snapshot. Built once per snapshot through
 * {@link GraphSnapshot#memo} and read-only afterwards.
 *
 * <p>Fields are folded into one weighted bag of terms: label tokens count
 * three times, keywords twice, use cases and description once.
 *
 * @since 1.0.0
 */
final class KeywordIndex {

    static final double K1 = 1.2;
    static final double B = 0.75;

    private static final double LABEL_WEIGHT = 3.0;
    private static final double KEYWORD_WEIGHT = 2.0;
    private static final double TEXT_WEIGHT = 1.0;

    /** Ties by ascending id. */
    static final Comparator<Hit> RANKING = Comparator.comparingDouble(Hit::score).reversed()
        .thenComparing(Hit::entityId);

    record Hit(String entityId, double score, List<String> matchedTerms) {
    }

    private final Map<String, Map<String, Double>> termFrequencies = new LinkedHashMap<>();
    private final Map<String, Double> documentLengths = new HashMap<>();
    private final Map<String, Integer> documentFrequencies = new HashMap<>();
    private final double averageLength;

    private KeywordIndex(GraphSnapshot snapshot) {
        double totalLength = 0;
        for (Entity entity : snapshot.entities()) {
            Map<String, Double> tf = new HashMap<>();
            addField(tf, entity.getLabel(), LABEL_WEIGHT);
            entity.stringList(MetadataKeys.KEYWORDS).forEach(k -> addField(tf, k, KEYWORD_WEIGHT));
            entity.stringList(MetadataKeys.USE_CASES).forEach(u -> addField(tf, u, TEXT_WEIGHT));
            addField(tf, entity.getDescription(), TEXT_WEIGHT);

            double length = tf.values().stream().mapToDouble(Double::doubleValue).sum();
            termFrequencies.put(entity.getId(), tf);
            documentLengths.put(entity.getId(), length);
            totalLength += length;
            tf.keySet().forEach(term -> documentFrequencies.merge(term, 1, Integer::sum));
        }
        averageLength = termFrequencies.isEmpty() ? 0 : totalLength / termFrequencies.size();
    }

    static KeywordIndex of(GraphSnapshot snapshot) {
        return snapshot.memo(KeywordIndex.class, KeywordIndex::new);
    }

    /**
     * Every entity matching at least one query term, scored and normalised by
     * the best raw score, in ranking order.
     */
    List<Hit> search(String text) {
        Set<String> terms = new LinkedHashSet<>(TextUtils.tokenize(text));
        if (terms.isEmpty() || termFrequencies.isEmpty()) {
            return List.of();
        }
        int documents = termFrequencies.size();
        List<Hit> raw = new ArrayList<>();
        for (Map.Entry<String, Map<String, Double>> doc : termFrequencies.entrySet()) {
            double score = 0;
            Set<String> matched = new TreeSet<>();
            double norm = K1 * (1 - B + B * documentLengths.get(doc.getKey()) / averageLength);
            for (String term : terms) {
                Double tf = doc.getValue().get(term);
                if (tf == null) {
                    continue;
                }
                int df = documentFrequencies.get(term);
                double idf = Math.log(1 + (documents - df + 0.5) / (df + 0.5));
                score += idf * tf * (K1 + 1) / (tf + norm);
                matched.add(term);
            }
            if (score > 0) {
                raw.add(new Hit(doc.getKey(), score, List.copyOf(matched)));
            }
        }
        if (raw.isEmpty()) {
            return List.of();
        }
        double best = Collections.max(raw, Comparator.comparingDouble(Hit::score)).score();
        List<Hit> normalised = new ArrayList<>(raw.size());
        for (Hit hit : raw) {
            normalised.add(new Hit(hit.entityId(), hit.score() / best, hit.matchedTerms()));
        }
        normalised.sort(RANKING);
        return normalised;
    }

    /**
     * Query terms that occur anywhere in the entity's indexed fields.
     */
    List<String> matchedTerms(String entityId, String text) {
        Map<String, Double> tf = termFrequencies.getOrDefault(entityId, Map.of());
        Set<String> matched = new TreeSet<>();
        for (String term : TextUtils.tokenize(text)) {
            if (tf.containsKey(term)) {
                matched.add(term);
            }
        }
        return List.copyOf(matched);
    }

    private static void addField(Map<String, Double> tf, String text, double weight) {
        for (String token : TextUtils.tokenize(text)) {
            tf.merge(token, weight, Double::sum);
        }
    }
}
