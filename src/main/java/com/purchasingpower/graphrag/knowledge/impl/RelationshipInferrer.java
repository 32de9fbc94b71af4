package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.config.BuilderProperties;
import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.EntityCategory;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.RelationshipHints;
import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.knowledge.CatalogPattern;
import com.purchasingpower.graphrag.template.TemplateLibrary;
import com.purchasingpower.graphrag.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives typed, weighted edges from categories, workflow patterns, declared
 * dependencies, the known-pairs rule table and embedding similarity.
 *
 * <p>Every candidate edge scores
 * {@code clamp01(typeBase + similarityWeight * s + cooccurrenceWeight * c)}, where
 * {@code s} is the pair's cosine similarity (zero below the candidate threshold)
 * and {@code c} is its pattern co-occurrence relative to the busiest pair. Rule
 * pairs keep the larger of that score and their rule strength. Candidates are
 * then admitted strongest first while both endpoints stay under the fan-out cap.
 *
 * <p>Only ids present in the extracted entity set are ever used as endpoints.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class RelationshipInferrer {

    static final Comparator<Relationship> STORAGE_ORDER = Comparator
        .comparing(Relationship::getSourceId)
        .thenComparing(Relationship::getTargetId)
        .thenComparing(Relationship::getType);

    private final InferenceRules rules;
    private final TemplateLibrary templates;
    private final BuilderProperties settings;

    @Autowired
    public RelationshipInferrer(TemplateLibrary templates, GraphRagProperties properties) {
        this(InferenceRules.load(InferenceRules.DEFAULT_RESOURCE), templates, properties);
    }

    public RelationshipInferrer(InferenceRules rules, TemplateLibrary templates, GraphRagProperties properties) {
        this.rules = rules;
        this.templates = templates;
        this.settings = properties.getBuilder();
    }

    /**
     * @param entities extracted entities, with embeddings where available
     * @param patterns workflow patterns; members not in {@code entities} are ignored
     * @param requires declared dependencies by entity id; unknown targets are ignored
     * @return edges ordered by source, target and type
     */
    public List<Relationship> infer(List<Entity> entities,
                                    List<CatalogPattern> patterns,
                                    Map<String, List<String>> requires) {
        Map<String, Entity> byId = new TreeMap<>();
        entities.forEach(e -> byId.put(e.getId(), e));

        Map<String, Candidate> candidates = new LinkedHashMap<>();
        Map<String, Set<String>> pairPatterns = new HashMap<>();
        Map<RelationshipType, Integer> proposed = new EnumMap<>(RelationshipType.class);

        addPatternCandidates(byId, patterns, candidates, pairPatterns);
        addCategoryCandidates(byId, candidates);
        addRequiresCandidates(byId, requires, candidates);
        addRuleCandidates(byId, candidates);
        addSimilarityCandidates(byId, candidates);
        candidates.values().forEach(c -> proposed.merge(c.type, 1, Integer::sum));

        int maxCooccurrence = pairPatterns.values().stream().mapToInt(Set::size).max().orElse(0);
        List<Relationship> scored = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates.values()) {
            scored.add(toRelationship(candidate, byId, pairPatterns, maxCooccurrence));
        }

        List<Relationship> accepted = applyFanOutCap(scored);
        accepted.sort(STORAGE_ORDER);
        log.info("🔗 Inferred {} relationships from {} candidates (cap {} per entity) {}",
            accepted.size(), candidates.size(), settings.getMaxEdgesPerEntity(), proposed);
        return accepted;
    }

    // ================================================================
    // CANDIDATE GENERATION
    // ================================================================

    private void addPatternCandidates(Map<String, Entity> byId,
                                      List<CatalogPattern> patterns,
                                      Map<String, Candidate> candidates,
                                      Map<String, Set<String>> pairPatterns) {
        for (CatalogPattern pattern : patterns) {
            List<String> members = new ArrayList<>(new LinkedHashSet<>(pattern.getNodes()));
            int declared = members.size();
            members.removeIf(id -> !byId.containsKey(id));
            if (members.size() < declared) {
                log.debug("Pattern {} references {} unknown ids, ignored", pattern.displayName(), declared - members.size());
            }
            String name = pattern.displayName();
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    pairPatterns.computeIfAbsent(pairKey(members.get(i), members.get(j)), k -> new LinkedHashSet<>()).add(name);
                    candidate(candidates, members.get(i), members.get(j), RelationshipType.USED_IN_PATTERN).patterns.add(name);
                }
            }
            for (int i = 0; i + 1 < members.size(); i++) {
                candidate(candidates, members.get(i), members.get(i + 1), RelationshipType.COMPATIBLE_WITH).patterns.add(name);
            }
            if (!members.isEmpty() && isTrigger(byId.get(members.get(0)))) {
                for (int j = 1; j < members.size(); j++) {
                    candidate(candidates, members.get(j), members.get(0), RelationshipType.TRIGGERED_BY).patterns.add(name);
                }
            }
        }
    }

    private void addCategoryCandidates(Map<String, Entity> byId, Map<String, Candidate> candidates) {
        Map<EntityCategory, List<String>> byCategory = new EnumMap<>(EntityCategory.class);
        byId.values().forEach(e -> byCategory.computeIfAbsent(e.getCategory(), k -> new ArrayList<>()).add(e.getId()));
        byCategory.forEach((category, ids) -> {
            // "other" is a fallback bucket, not a shared capability
            if (category == EntityCategory.OTHER) {
                return;
            }
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    candidate(candidates, ids.get(i), ids.get(j), RelationshipType.BELONGS_TO_CATEGORY);
                }
            }
        });
    }

    private void addRequiresCandidates(Map<String, Entity> byId,
                                       Map<String, List<String>> requires,
                                       Map<String, Candidate> candidates) {
        requires.forEach((sourceId, targets) -> {
            if (!byId.containsKey(sourceId)) {
                return;
            }
            for (String targetId : targets) {
                if (byId.containsKey(targetId) && !sourceId.equals(targetId)) {
                    candidate(candidates, sourceId, targetId, RelationshipType.REQUIRES);
                } else {
                    log.debug("Dropping requires {} -> {}: unknown or self", sourceId, targetId);
                }
            }
        });
    }

    private void addRuleCandidates(Map<String, Entity> byId, Map<String, Candidate> candidates) {
        for (InferenceRules.CompatiblePair rule : rules.getCompatiblePairs()) {
            List<String> sources = matching(byId, rule.getSource());
            List<String> targets = matching(byId, rule.getTarget());
            for (String sourceId : sources) {
                for (String targetId : targets) {
                    if (!sourceId.equals(targetId)) {
                        candidate(candidates, sourceId, targetId, RelationshipType.COMPATIBLE_WITH).rule = rule;
                    }
                }
            }
        }
    }

    private void addSimilarityCandidates(Map<String, Entity> byId, Map<String, Candidate> candidates) {
        List<Entity> embedded = byId.values().stream().filter(Entity::hasEmbedding).toList();
        for (int i = 0; i < embedded.size(); i++) {
            for (int j = i + 1; j < embedded.size(); j++) {
                double similarity = embedded.get(i).getEmbedding().cosine(embedded.get(j).getEmbedding());
                if (similarity > settings.getSimilarToThreshold()) {
                    candidate(candidates, embedded.get(i).getId(), embedded.get(j).getId(), RelationshipType.SIMILAR_TO);
                }
            }
        }
    }

    // ================================================================
    // SCORING
    // ================================================================

    private Relationship toRelationship(Candidate candidate,
                                        Map<String, Entity> byId,
                                        Map<String, Set<String>> pairPatterns,
                                        int maxCooccurrence) {
        Entity source = byId.get(candidate.sourceId);
        Entity target = byId.get(candidate.targetId);
        double similarity = similarity(source, target);
        double s = similarity >= settings.getCandidateSimilarityThreshold() ? similarity : 0.0;
        Set<String> sharedPatterns = pairPatterns.getOrDefault(pairKey(candidate.sourceId, candidate.targetId), Set.of());
        double c = maxCooccurrence == 0 ? 0.0 : (double) sharedPatterns.size() / maxCooccurrence;

        double strength = TextUtils.clamp01(settings.baseFor(candidate.type)
            + settings.getSimilarityWeight() * s
            + settings.getCooccurrenceWeight() * c);
        if (candidate.rule != null) {
            strength = Math.max(strength, TextUtils.clamp01(candidate.rule.getStrength()));
        }

        return Relationship.builder()
            .sourceId(candidate.sourceId)
            .targetId(candidate.targetId)
            .type(candidate.type)
            .strength(strength)
            .reasoning(reasoning(candidate, source, target, similarity))
            .hints(hints(candidate, source, target))
            .build();
    }

    private String reasoning(Candidate candidate, Entity source, Entity target, double similarity) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("source", source.getLabel());
        vars.put("target", target.getLabel());
        vars.put("category", source.getCategory().id());
        vars.put("patterns", candidate.patterns.isEmpty() ? "known workflows" : String.join(", ", candidate.patterns));
        vars.put("similarity", String.format(Locale.ROOT, "%.0f%%", similarity * 100));
        vars.put("trigger", target.getLabel());
        vars.put("step", source.getLabel());
        if (candidate.type == RelationshipType.COMPATIBLE_WITH && candidate.rule != null && candidate.patterns.isEmpty()) {
            vars.put("ruleReasoning", candidate.rule.getReasoning());
            return templates.render("reasoning", "compatible-with-rule", vars);
        }
        return templates.render("reasoning", candidate.type.wireName(), vars);
    }

    private RelationshipHints hints(Candidate candidate, Entity source, Entity target) {
        Map<String, Object> vars = Map.of("source", source.getLabel(), "target", target.getLabel());
        return switch (candidate.type) {
            case COMPATIBLE_WITH -> RelationshipHints.builder()
                .configMapping(candidate.rule != null ? candidate.rule.getMapping() : null)
                .pitfalls(candidate.rule != null ? List.copyOf(candidate.rule.getPitfalls()) : List.of())
                .guidance(templates.render("reasoning", "guidance-compatible", vars))
                .build();
            case SIMILAR_TO -> RelationshipHints.builder()
                .guidance(templates.render("reasoning", "guidance-similar", vars))
                .build();
            default -> null;
        };
    }

    /**
     * Greedy admission by descending strength, ties by type, source and target.
     * An edge is kept only while both endpoints are below the cap.
     */
    List<Relationship> applyFanOutCap(List<Relationship> scored) {
        int cap = settings.getMaxEdgesPerEntity();
        List<Relationship> ordered = new ArrayList<>(scored);
        ordered.sort(Comparator.comparingDouble(Relationship::getStrength).reversed()
            .thenComparing(Relationship::getType)
            .thenComparing(Relationship::getSourceId)
            .thenComparing(Relationship::getTargetId));
        Map<String, Integer> degree = new HashMap<>();
        List<Relationship> accepted = new ArrayList<>();
        for (Relationship edge : ordered) {
            int sourceDegree = degree.getOrDefault(edge.getSourceId(), 0);
            int targetDegree = degree.getOrDefault(edge.getTargetId(), 0);
            if (sourceDegree < cap && targetDegree < cap) {
                accepted.add(edge);
                degree.put(edge.getSourceId(), sourceDegree + 1);
                degree.put(edge.getTargetId(), targetDegree + 1);
            }
        }
        return accepted;
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private Candidate candidate(Map<String, Candidate> candidates, String sourceId, String targetId, RelationshipType type) {
        String a = sourceId;
        String b = targetId;
        if (type.isSymmetric() && a.compareTo(b) > 0) {
            a = targetId;
            b = sourceId;
        }
        String key = Relationship.key(a, type, b);
        String from = a;
        String to = b;
        return candidates.computeIfAbsent(key, k -> new Candidate(from, to, type));
    }

    private boolean isTrigger(Entity entity) {
        return entity != null && rules.getTriggerCategories().contains(entity.getCategory().id());
    }

    private static List<String> matching(Map<String, Entity> byId, String key) {
        if (key == null || key.isBlank()) {
            return List.of();
        }
        String needle = key.toLowerCase(Locale.ROOT);
        List<String> ids = new ArrayList<>();
        for (Entity entity : byId.values()) {
            if (TextUtils.tokenize(entity.getId()).contains(needle) || TextUtils.tokenize(entity.getLabel()).contains(needle)) {
                ids.add(entity.getId());
            }
        }
        return ids;
    }

    private static double similarity(Entity a, Entity b) {
        EmbeddingVector va = a.getEmbedding();
        EmbeddingVector vb = b.getEmbedding();
        if (va == null || vb == null || va.dimension() != vb.dimension()) {
            return 0.0;
        }
        return va.cosine(vb);
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    private static final class Candidate {
        private final String sourceId;
        private final String targetId;
        private final RelationshipType type;
        private final Set<String> patterns = new LinkedHashSet<>();
        private InferenceRules.CompatiblePair rule;

        private Candidate(String sourceId, String targetId, RelationshipType type) {
            this.sourceId = sourceId;
            this.targetId = targetId;
            this.type = type;
        }
    }
}
