package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.core.TraversalDirection;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read-side entry point over the current graph snapshot.
 *
 * <p>Provides a single interface for:
 * <ul>
 *   <li>Semantic search - vector similarity against entity embeddings</li>
 *   <li>Keyword search - BM25 over labels, keywords, use cases and descriptions</li>
 *   <li>Hybrid search - weighted fusion of both plus a graph-neighbour boost</li>
 *   <li>Traversal - bounded neighbourhoods and simple paths</li>
 *   <li>Advice - alternatives, integration routes and dependency cycles</li>
 * </ul>
 *
 * <p>Every call reads one snapshot from start to finish, so a build committing
 * mid-query never mixes two graph versions in one answer.
 *
 * @since 1.0.0
 */
public interface QueryEngine {

    /**
     * Nearest entities by embedding similarity. Degrades to keyword search
     * when the query cannot be embedded or no entity has a vector.
     *
     * @param text Natural language query
     * @param k Number of results, clamped to [1, entity count]
     * @throws com.purchasingpower.graphrag.exception.ValidationException on blank text
     */
    SearchResponse semanticSearch(String text, int k);

    /**
     * BM25 keyword search; scores normalised to [0,1] by the best hit.
     */
    SearchResponse keywordSearch(String text, int k);

    /**
     * Weighted fusion of semantic and keyword candidates.
     *
     * @throws com.purchasingpower.graphrag.exception.ValidationException on blank text or invalid weights
     */
    SearchResponse hybridSearch(String text, SearchOptions options);

    /**
     * Dispatch on {@link SearchOptions#getMode()}.
     */
    SearchResponse search(String text, SearchOptions options);

    NeighborResult neighbors(String entityId, int depth);

    /**
     * Entities within {@code depth} hops, each at its minimum hop distance.
     *
     * @param types Relationship types to follow; empty follows all
     * @throws com.purchasingpower.graphrag.exception.NotFoundException for an unknown id
     */
    NeighborResult neighbors(String entityId, int depth, TraversalDirection direction, Set<RelationshipType> types);

    /**
     * Lazily enumerated simple paths, shallowest first, walking edges in
     * either direction. The stream is bound to the snapshot current at call time.
     */
    default Stream<GraphPath> streamPaths(String sourceId, String targetId, int maxHops, int maxPaths) {
        return streamPaths(sourceId, targetId, maxHops, maxPaths, TraversalDirection.BOTH);
    }

    /**
     * @param direction {@link TraversalDirection#OUTGOING} keeps to stored edge direction
     */
    Stream<GraphPath> streamPaths(String sourceId, String targetId, int maxHops, int maxPaths,
                                  TraversalDirection direction);

    default PathSearchResult findPaths(String sourceId, String targetId, int maxHops, int maxPaths) {
        return findPaths(sourceId, targetId, maxHops, maxPaths, TraversalDirection.BOTH);
    }

    PathSearchResult findPaths(String sourceId, String targetId, int maxHops, int maxPaths,
                               TraversalDirection direction);

    /**
     * Entities that can replace {@code entityId}: its {@code similar-to} and
     * same-category neighbours, strongest link first, then by id.
     *
     * @throws com.purchasingpower.graphrag.exception.NotFoundException for an unknown id
     * @throws com.purchasingpower.graphrag.exception.ValidationException when k is not positive
     */
    List<Alternative> alternatives(String entityId, int k);

    Explanation explainAlternatives(String entityId, List<Alternative> alternatives);

    /**
     * How to connect source to target, told along the most confident path
     * within {@code maxHops}. Says so when no route exists.
     */
    Explanation explainIntegration(String sourceId, String targetId, int maxHops);

    /**
     * Cycles of {@code requires} and {@code compatible-with} edges anywhere in the graph.
     */
    List<DependencyCycle> circularDependencies();

    /**
     * True when a {@code requires}/{@code compatible-with} chain starting at the
     * entity runs into a cycle.
     */
    boolean hasCircularDependency(String entityId);

    Explanation explain(String queryText, String entityId);

    /**
     * Explain a hit returned by a search, including the edges behind its graph boost.
     */
    Explanation explain(String queryText, ScoredEntity result);

    Explanation explainPath(GraphPath path);
}
