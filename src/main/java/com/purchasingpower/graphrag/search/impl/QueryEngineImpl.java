package com.purchasingpower.graphrag.search.impl;

import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.config.QueryProperties;
import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.EntityCategory;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.core.SearchMode;
import com.purchasingpower.graphrag.core.TraversalDirection;
import com.purchasingpower.graphrag.exception.EmbeddingUnavailableException;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.knowledge.impl.GuardedEmbeddingClient;
import com.purchasingpower.graphrag.search.Alternative;
import com.purchasingpower.graphrag.search.DependencyCycle;
import com.purchasingpower.graphrag.search.Explanation;
import com.purchasingpower.graphrag.search.GraphPath;
import com.purchasingpower.graphrag.search.GraphTraversalService;
import com.purchasingpower.graphrag.search.HybridWeights;
import com.purchasingpower.graphrag.search.NeighborResult;
import com.purchasingpower.graphrag.search.PathSearchResult;
import com.purchasingpower.graphrag.search.QueryEngine;
import com.purchasingpower.graphrag.search.ScoredEntity;
import com.purchasingpower.graphrag.search.SearchOptions;
import com.purchasingpower.graphrag.search.SearchResponse;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.GraphStore;
import com.purchasingpower.graphrag.storage.NeighborMatch;
import com.purchasingpower.graphrag.storage.QueryTrace;
import com.purchasingpower.graphrag.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Default implementation of QueryEngine.
 *
 * <p>Orchestrates semantic, keyword and hybrid search over the current
 * snapshot. When the query cannot be embedded, or the snapshot has no vectors,
 * semantic and hybrid requests fall back to keyword search and the response
 * says so.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryEngineImpl implements QueryEngine {

    /** Combined score desc, semantic score desc, id asc. */
    static final Comparator<ScoredEntity> RANKING = Comparator.comparingDouble(ScoredEntity::getScore).reversed()
        .thenComparing(Comparator.comparingDouble(ScoredEntity::getSemanticScore).reversed())
        .thenComparing(ScoredEntity::getId);

    /** Strength desc, id asc. */
    static final Comparator<Alternative> ALTERNATIVE_RANKING = Comparator.comparingDouble(Alternative::getStrength).reversed()
        .thenComparing(Alternative::getId);

    private static final Predicate<Entity> ALL = entity -> true;

    private static final Set<RelationshipType> SUBSTITUTE_TYPES =
        EnumSet.of(RelationshipType.SIMILAR_TO, RelationshipType.BELONGS_TO_CATEGORY);

    private static final Set<RelationshipType> DEPENDENCY_TYPES =
        EnumSet.of(RelationshipType.REQUIRES, RelationshipType.COMPATIBLE_WITH);

    /** Paths weighed when picking an integration route. */
    private static final int INTEGRATION_CANDIDATES = 20;

    private final GraphStore graphStore;
    private final GuardedEmbeddingClient embeddingClient;
    private final GraphTraversalService traversalService;
    private final ExplanationGenerator explanationGenerator;
    private final GraphRagProperties properties;

    // =========================================================================
    // Search
    // =========================================================================

    @Override
    public SearchResponse semanticSearch(String text, int k) {
        return search(text, DefaultSearchOptions.builder().mode(SearchMode.SEMANTIC).maxResults(k).build());
    }

    @Override
    public SearchResponse keywordSearch(String text, int k) {
        return search(text, DefaultSearchOptions.builder().mode(SearchMode.KEYWORD).maxResults(k).build());
    }

    @Override
    public SearchResponse hybridSearch(String text, SearchOptions options) {
        SearchOptions effective = options != null ? options : DefaultSearchOptions.hybrid(10);
        return run(text, effective, SearchMode.HYBRID);
    }

    @Override
    public SearchResponse search(String text, SearchOptions options) {
        SearchOptions effective = options != null ? options : DefaultSearchOptions.hybrid(10);
        SearchMode mode = effective.getMode() != null ? effective.getMode() : SearchMode.HYBRID;
        return run(text, effective, mode);
    }

    private SearchResponse run(String text, SearchOptions options, SearchMode requested) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Query text must not be blank");
        }
        HybridWeights weights = requested == SearchMode.HYBRID ? resolveWeights(options) : null;
        long start = System.currentTimeMillis();
        GraphSnapshot snapshot = graphStore.snapshot();
        int k = clampK(options.getMaxResults(), snapshot.entityCount());
        Predicate<Entity> filter = categoryFilter(options.getCategories());
        log.info("Searching ({}) for '{}' in graph v{}", requested, TextUtils.truncate(text, 80), snapshot.version());

        SearchMode executed = requested;
        String degradation = null;
        List<ScoredEntity> results;

        if (snapshot.entityCount() == 0) {
            results = List.of();
        } else if (requested == SearchMode.KEYWORD) {
            results = keyword(snapshot, text, k, filter);
        } else {
            EmbeddingVector queryVector = null;
            if (snapshot.embeddingCount() == 0) {
                degradation = "no entity has an embedding";
            } else {
                try {
                    queryVector = embeddingClient.embedQuery(text, options.getTimeout());
                    if (queryVector.dimension() != snapshot.dimension()) {
                        degradation = "query vector dimension " + queryVector.dimension()
                            + " does not match graph dimension " + snapshot.dimension();
                    }
                } catch (EmbeddingUnavailableException e) {
                    degradation = "embedding unavailable: " + e.getMessage();
                }
            }

            if (degradation != null) {
                log.warn("⚠️ {} search degraded to keyword: {}", requested, degradation);
                executed = SearchMode.KEYWORD;
                results = keyword(snapshot, text, k, filter);
            } else if (requested == SearchMode.SEMANTIC) {
                results = semantic(snapshot, text, queryVector, k, filter);
            } else {
                results = hybrid(snapshot, text, queryVector, k, filter, weights);
            }
        }

        long latency = System.currentTimeMillis() - start;
        SearchResponse response = SearchResponse.builder()
            .query(text)
            .requestedMode(requested)
            .executedMode(executed)
            .degraded(degradation != null)
            .degradationReason(degradation)
            .results(List.copyOf(results))
            .latencyMs(latency)
            .snapshotVersion(snapshot.version())
            .build();
        graphStore.recordQuery(new QueryTrace(Instant.now(), text, requested, executed,
            response.isDegraded(), results.size(), latency));
        log.debug("Search returned {} results in {}ms", results.size(), latency);
        return response;
    }

    private List<ScoredEntity> keyword(GraphSnapshot snapshot, String text, int k, Predicate<Entity> filter) {
        List<ScoredEntity> results = new ArrayList<>();
        for (KeywordIndex.Hit hit : KeywordIndex.of(snapshot).search(text)) {
            Entity entity = snapshot.entity(hit.entityId());
            if (!filter.test(entity)) {
                continue;
            }
            results.add(ScoredEntity.builder()
                .entity(entity)
                .score(hit.score())
                .keywordScore(hit.score())
                .matchedTerms(hit.matchedTerms())
                .build());
            if (results.size() == k) {
                break;
            }
        }
        return results;
    }

    private List<ScoredEntity> semantic(GraphSnapshot snapshot, String text, EmbeddingVector queryVector,
                                        int k, Predicate<Entity> filter) {
        KeywordIndex index = KeywordIndex.of(snapshot);
        int request = filter == ALL ? k : snapshot.entityCount();
        List<ScoredEntity> results = new ArrayList<>();
        for (NeighborMatch match : snapshot.nearestNeighbors(queryVector, request)) {
            Entity entity = snapshot.entity(match.entityId());
            if (!filter.test(entity)) {
                continue;
            }
            double similarity = TextUtils.clamp01(match.similarity());
            results.add(ScoredEntity.builder()
                .entity(entity)
                .score(similarity)
                .semanticScore(similarity)
                .matchedTerms(index.matchedTerms(entity.getId(), text))
                .build());
            if (results.size() == k) {
                break;
            }
        }
        return results;
    }

    /**
     * Fuses both candidate pools. The graph boost only ever re-ranks entities
     * already in the pool.
     */
    private List<ScoredEntity> hybrid(GraphSnapshot snapshot, String text, EmbeddingVector queryVector,
                                      int k, Predicate<Entity> filter, HybridWeights weights) {
        QueryProperties query = properties.getQuery();
        int pool = filter == ALL
            ? Math.min(snapshot.entityCount(), k * query.getCandidateMultiplier())
            : snapshot.entityCount();

        List<NeighborMatch> semanticHits = snapshot.nearestNeighbors(queryVector, pool);
        List<KeywordIndex.Hit> keywordHits = KeywordIndex.of(snapshot).search(text);
        Map<String, KeywordIndex.Hit> keywordById = new LinkedHashMap<>();
        keywordHits.forEach(hit -> keywordById.put(hit.entityId(), hit));

        Set<String> candidates = new LinkedHashSet<>();
        semanticHits.forEach(match -> candidates.add(match.entityId()));
        keywordHits.stream().limit(pool).forEach(hit -> candidates.add(hit.entityId()));

        Map<String, List<Relationship>> evidence = graphEvidence(snapshot, semanticHits, query.getGraphBoostSeeds());

        List<ScoredEntity> scored = new ArrayList<>();
        for (String id : candidates) {
            Entity entity = snapshot.entity(id);
            if (!filter.test(entity)) {
                continue;
            }
            double semanticScore = snapshot.vector(id)
                .map(v -> TextUtils.clamp01(v.cosine(queryVector)))
                .orElse(0.0);
            KeywordIndex.Hit keywordHit = keywordById.get(id);
            double keywordScore = keywordHit != null ? keywordHit.score() : 0.0;
            List<Relationship> links = evidence.getOrDefault(id, List.of());
            double boost = links.isEmpty() ? 0.0 : weights.graph();

            scored.add(ScoredEntity.builder()
                .entity(entity)
                .score(weights.semantic() * semanticScore + weights.keyword() * keywordScore + boost)
                .semanticScore(semanticScore)
                .keywordScore(keywordScore)
                .graphBoost(boost)
                .matchedTerms(keywordHit != null ? keywordHit.matchedTerms() : List.of())
                .graphEvidence(List.copyOf(links))
                .build());
        }
        scored.sort(RANKING);
        return scored.size() > k ? scored.subList(0, k) : scored;
    }

    /**
     * Edges from the top semantic hits, keyed by the entity at the other end.
     */
    private static Map<String, List<Relationship>> graphEvidence(GraphSnapshot snapshot, List<NeighborMatch> semanticHits,
                                                                 int seeds) {
        Map<String, List<Relationship>> evidence = new LinkedHashMap<>();
        for (NeighborMatch seed : semanticHits.stream().limit(seeds).toList()) {
            for (Relationship edge : snapshot.adjacent(seed.entityId(), TraversalDirection.BOTH)) {
                evidence.computeIfAbsent(edge.other(seed.entityId()), id -> new ArrayList<>()).add(edge);
            }
        }
        return evidence;
    }

    // =========================================================================
    // Traversal
    // =========================================================================

    @Override
    public NeighborResult neighbors(String entityId, int depth) {
        return neighbors(entityId, depth, TraversalDirection.BOTH, Set.of());
    }

    @Override
    public NeighborResult neighbors(String entityId, int depth, TraversalDirection direction, Set<RelationshipType> types) {
        return traversalService.neighbors(graphStore.snapshot(), entityId, depth, direction, types,
            properties.getQuery().getMaxNeighborResults());
    }

    @Override
    public Stream<GraphPath> streamPaths(String sourceId, String targetId, int maxHops, int maxPaths,
                                         TraversalDirection direction) {
        Iterator<GraphPath> paths = traversalService.paths(graphStore.snapshot(), sourceId, targetId,
            direction, maxHops, maxPaths);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(paths, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public PathSearchResult findPaths(String sourceId, String targetId, int maxHops, int maxPaths,
                                      TraversalDirection direction) {
        if (maxPaths <= 0) {
            throw new ValidationException("maxPaths must be positive, got " + maxPaths);
        }
        // One extra path tells whether the bound cut the search short
        Iterator<GraphPath> paths = traversalService.paths(graphStore.snapshot(), sourceId, targetId,
            direction, maxHops, maxPaths == Integer.MAX_VALUE ? maxPaths : maxPaths + 1);
        List<GraphPath> found = new ArrayList<>();
        while (found.size() < maxPaths && paths.hasNext()) {
            found.add(paths.next());
        }
        boolean truncated = paths.hasNext();
        log.debug("Found {} path(s) from {} to {} within {} hops", found.size(), sourceId, targetId, maxHops);
        return new PathSearchResult(sourceId, targetId, List.copyOf(found), truncated);
    }

    @Override
    public List<Alternative> alternatives(String entityId, int k) {
        if (k <= 0) {
            throw new ValidationException("k must be positive, got " + k);
        }
        GraphSnapshot snapshot = graphStore.snapshot();
        snapshot.entity(entityId); // fails on unknown ids

        Map<String, Relationship> strongest = new HashMap<>();
        for (Relationship edge : snapshot.adjacent(entityId, TraversalDirection.BOTH)) {
            String other = edge.other(entityId);
            if (SUBSTITUTE_TYPES.contains(edge.getType()) && !other.equals(entityId)) {
                strongest.merge(other, edge, QueryEngineImpl::stronger);
            }
        }
        List<Alternative> ranked = strongest.entrySet().stream()
            .map(entry -> new Alternative(snapshot.entity(entry.getKey()), entry.getValue()))
            .sorted(ALTERNATIVE_RANKING)
            .limit(k)
            .toList();
        log.debug("Found {} alternative(s) to {}", ranked.size(), entityId);
        return ranked;
    }

    @Override
    public List<DependencyCycle> circularDependencies() {
        return traversalService.cycles(graphStore.snapshot(), DEPENDENCY_TYPES, null);
    }

    @Override
    public boolean hasCircularDependency(String entityId) {
        return !traversalService.cycles(graphStore.snapshot(), DEPENDENCY_TYPES, entityId).isEmpty();
    }

    // =========================================================================
    // Explanations
    // =========================================================================

    /**
     * Explains an entity without re-running the search. Graph evidence is taken
     * from edges to the best keyword hits, which needs no embedding call.
     */
    @Override
    public Explanation explain(String queryText, String entityId) {
        GraphSnapshot snapshot = graphStore.snapshot();
        Entity entity = snapshot.entity(entityId);
        String query = queryText != null ? queryText : "";
        KeywordIndex index = KeywordIndex.of(snapshot);

        Set<String> seeds = new LinkedHashSet<>();
        index.search(query).stream()
            .map(KeywordIndex.Hit::entityId)
            .filter(id -> !id.equals(entityId))
            .limit(properties.getQuery().getGraphBoostSeeds())
            .forEach(seeds::add);
        List<Relationship> links = new ArrayList<>();
        for (Relationship edge : snapshot.adjacent(entityId, TraversalDirection.BOTH)) {
            if (seeds.contains(edge.other(entityId))) {
                links.add(edge);
            }
        }

        ScoredEntity subject = ScoredEntity.builder()
            .entity(entity)
            .matchedTerms(index.matchedTerms(entityId, query))
            .graphEvidence(List.copyOf(links))
            .build();
        return explanationGenerator.explain(snapshot, query, subject);
    }

    @Override
    public Explanation explain(String queryText, ScoredEntity result) {
        return explanationGenerator.explain(graphStore.snapshot(), queryText != null ? queryText : "", result);
    }

    @Override
    public Explanation explainPath(GraphPath path) {
        return explanationGenerator.explainPath(graphStore.snapshot(), path);
    }

    @Override
    public Explanation explainAlternatives(String entityId, List<Alternative> alternatives) {
        GraphSnapshot snapshot = graphStore.snapshot();
        return explanationGenerator.explainAlternatives(snapshot, snapshot.entity(entityId),
            alternatives != null ? alternatives : List.of());
    }

    /**
     * Picks the most confident path; on a tie the shallower one wins because
     * paths arrive shallowest first.
     */
    @Override
    public Explanation explainIntegration(String sourceId, String targetId, int maxHops) {
        GraphSnapshot snapshot = graphStore.snapshot();
        Iterator<GraphPath> paths = traversalService.paths(snapshot, sourceId, targetId,
            TraversalDirection.BOTH, maxHops, INTEGRATION_CANDIDATES);
        GraphPath best = null;
        while (paths.hasNext()) {
            GraphPath path = paths.next();
            if (best == null || path.confidence() > best.confidence()) {
                best = path;
            }
        }
        if (best == null) {
            log.info("No integration route from {} to {} within {} hops", sourceId, targetId, maxHops);
        }
        return explanationGenerator.explainIntegration(snapshot, sourceId, targetId, maxHops, Optional.ofNullable(best));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static Relationship stronger(Relationship a, Relationship b) {
        if (a.getStrength() != b.getStrength()) {
            return a.getStrength() > b.getStrength() ? a : b;
        }
        return a.getType().wireName().compareTo(b.getType().wireName()) <= 0 ? a : b;
    }

    private static Predicate<Entity> categoryFilter(Set<EntityCategory> categories) {
        if (categories == null || categories.isEmpty()) {
            return ALL;
        }
        return entity -> categories.contains(entity.getCategory());
    }

    private HybridWeights resolveWeights(SearchOptions options) {
        QueryProperties defaults = properties.getQuery();
        return new HybridWeights(
            options.getSemanticWeight() != null ? options.getSemanticWeight() : defaults.getSemanticWeight(),
            options.getKeywordWeight() != null ? options.getKeywordWeight() : defaults.getKeywordWeight(),
            options.getGraphWeight() != null ? options.getGraphWeight() : defaults.getGraphWeight());
    }

    private static int clampK(int requested, int entityCount) {
        return Math.max(1, Math.min(requested, Math.max(1, entityCount)));
    }
}
