package com.purchasingpower.graphrag.search.impl;

import com.purchasingpower.graphrag.GraphFixtures;
import com.purchasingpower.graphrag.core.EntityCategory;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.core.TraversalDirection;
import com.purchasingpower.graphrag.exception.NotFoundException;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.knowledge.impl.HashingEmbeddingProvider;
import com.purchasingpower.graphrag.search.DependencyCycle;
import com.purchasingpower.graphrag.search.GraphPath;
import com.purchasingpower.graphrag.search.NeighborNode;
import com.purchasingpower.graphrag.search.NeighborResult;
import com.purchasingpower.graphrag.search.PathSearchResult;
import com.purchasingpower.graphrag.search.QueryEngine;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.impl.SnapshotGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Neighbourhood and path traversal over the three-node messaging graph:
 * Slack and Discord share a category, Slack and HTTP Request share a pattern.
 */
@DisplayName("Graph Traversal Tests")
class GraphTraversalServiceImplTest {

    private QueryEngine engine;
    private GraphSnapshot snapshot;
    private final GraphTraversalServiceImpl traversal = new GraphTraversalServiceImpl();

    @BeforeEach
    void setUp() {
        GraphFixtures.Pipeline pipeline = GraphFixtures.pipeline();
        assertTrue(pipeline.builder().build(GraphFixtures.load(GraphFixtures.MESSAGING_SCENARIO)).isSuccess());
        engine = pipeline.engine();
        snapshot = pipeline.store().snapshot();
    }

    // ================================================================
    // NEIGHBORS
    // ================================================================

    @Test
    @DisplayName("Should return exactly the direct neighbours at depth 1")
    void testDirectNeighbors() {
        NeighborResult result = engine.neighbors("slack", 1);

        assertThat(result.ids()).containsExactlyInAnyOrder("discord", "http-request");
        assertThat(result.getNeighbors()).allSatisfy(n -> {
            assertEquals(1, n.getHops());
            assertEquals("slack", n.getParentId());
            assertTrue(n.getVia().touches("slack"));
        });
        assertFalse(result.isTruncated());
    }

    @Test
    @DisplayName("Should report each entity once at its minimum hop count")
    void testMinimumHops() {
        NeighborResult result = engine.neighbors("discord", 2);

        assertThat(result.ids()).containsExactlyInAnyOrder("slack", "http-request");
        NeighborNode http = result.getNeighbors().stream()
            .filter(n -> n.getEntity().getId().equals("http-request"))
            .findFirst().orElseThrow();
        assertEquals(2, http.getHops());
        assertEquals("slack", http.getParentId());
        assertThat(result.ids()).doesNotContain("discord");
    }

    @Test
    @DisplayName("Should only follow the requested relationship types")
    void testTypeFilter() {
        NeighborResult result = engine.neighbors("slack", 2, TraversalDirection.BOTH,
            Set.of(RelationshipType.USED_IN_PATTERN));

        assertThat(result.ids()).containsExactly("http-request");
    }

    @Test
    @DisplayName("Should follow symmetric edges in any direction")
    void testDirection() {
        NeighborResult outgoing = engine.neighbors("discord", 1, TraversalDirection.OUTGOING, Set.of());
        NeighborResult incoming = engine.neighbors("discord", 1, TraversalDirection.INCOMING, Set.of());

        assertThat(outgoing.ids()).contains("slack");
        assertThat(incoming.ids()).contains("slack");
    }

    @Test
    @DisplayName("Should flag truncation when the neighbour limit is hit")
    void testNeighborLimit() {
        NeighborResult result = traversal.neighbors(snapshot, "slack", 2, TraversalDirection.BOTH, Set.of(), 1);

        assertThat(result.getNeighbors()).hasSize(1);
        assertTrue(result.isTruncated());
    }

    @Test
    @DisplayName("Should reject a non-positive depth and unknown roots")
    void testNeighborValidation() {
        assertThrows(ValidationException.class, () -> engine.neighbors("slack", 0));
        assertThrows(NotFoundException.class, () -> engine.neighbors("teams", 1));
    }

    // ================================================================
    // PATHS
    // ================================================================

    @Test
    @DisplayName("Should find simple paths through the shared neighbour")
    void testPaths() {
        PathSearchResult result = engine.findPaths("discord", "http-request", 2, 20);

        assertThat(result.getPaths()).isNotEmpty().allSatisfy(path -> {
            assertEquals("discord", path.source());
            assertEquals("http-request", path.last());
            assertEquals(List.of("discord", "slack", "http-request"), path.getEntityIds());
            assertThat(path.confidence()).isBetween(0.0, 1.0);
        });
        assertFalse(result.isTruncated());
    }

    @Test
    @DisplayName("Should return nothing when the hop bound is too small")
    void testHopBound() {
        assertThat(engine.findPaths("discord", "http-request", 1, 10).getPaths()).isEmpty();
    }

    @Test
    @DisplayName("Should return the zero-hop path when source equals target")
    void testTrivialPath() {
        PathSearchResult result = engine.findPaths("slack", "slack", 3, 5);

        assertThat(result.getPaths()).hasSize(1);
        assertEquals(0, result.getPaths().get(0).hops());
        assertEquals(1.0, result.getPaths().get(0).confidence());
        assertFalse(result.isTruncated());
    }

    @Test
    @DisplayName("Should stop at maxPaths and say the result was cut short")
    void testPathTruncation() {
        int available = engine.findPaths("discord", "http-request", 2, 50).getPaths().size();
        assertThat(available).isGreaterThan(1);

        PathSearchResult result = engine.findPaths("discord", "http-request", 2, 1);

        assertThat(result.getPaths()).hasSize(1);
        assertTrue(result.isTruncated());
    }

    @Test
    @DisplayName("Should enumerate paths lazily, shallowest first, without repeating nodes")
    void testLazyIteration() {
        Iterator<GraphPath> paths = traversal.paths(snapshot, "http-request", "discord", TraversalDirection.BOTH, 3, 100);

        int previousHops = 0;
        int count = 0;
        while (paths.hasNext()) {
            GraphPath path = paths.next();
            assertThat(path.hops()).isGreaterThanOrEqualTo(previousHops);
            assertEquals(path.getEntityIds().size(), Set.copyOf(path.getEntityIds()).size());
            previousHops = path.hops();
            count++;
        }
        assertThat(count).isPositive();
        assertThat(engine.streamPaths("http-request", "discord", 3, 100).count()).isEqualTo(count);
        assertThat(engine.streamPaths("http-request", "discord", 3, 100)
            .map(GraphPath::getEntityIds).collect(Collectors.toSet()))
            .allSatisfy(ids -> assertThat(ids).contains("slack"));
    }

    @Test
    @DisplayName("Should validate path bounds and endpoints")
    void testPathValidation() {
        assertThrows(ValidationException.class, () -> engine.findPaths("slack", "discord", 0, 5));
        assertThrows(ValidationException.class, () -> engine.findPaths("slack", "discord", 2, 0));
        assertThrows(NotFoundException.class, () -> engine.findPaths("slack", "teams", 2, 5));
    }

    @Test
    @DisplayName("Should reach a node linked only by a directed edge pointing back at the source")
    void testPathAgainstEdgeDirection() {
        // Given: a -requires-> b is the only link between them
        SnapshotGraphStore store = GraphFixtures.store();
        store.putEntity(GraphFixtures.node("a", "A", EntityCategory.OTHER));
        store.putEntity(GraphFixtures.node("b", "B", EntityCategory.OTHER));
        store.putEdge(GraphFixtures.link("a", RelationshipType.REQUIRES, "b", 0.9));
        QueryEngine reversed = GraphFixtures.pipeline(store,
            new HashingEmbeddingProvider(GraphFixtures.DIMENSION), GraphFixtures.properties()).engine();

        // When
        PathSearchResult either = reversed.findPaths("b", "a", 2, 5);
        PathSearchResult forwardOnly = reversed.findPaths("b", "a", 2, 5, TraversalDirection.OUTGOING);

        // Then: the default walk agrees with neighbors(), the directed walk does not cross the edge
        assertThat(reversed.neighbors("b", 1).ids()).containsExactly("a");
        assertThat(either.getPaths()).hasSize(1);
        assertEquals(List.of("b", "a"), either.getPaths().get(0).getEntityIds());
        assertThat(forwardOnly.getPaths()).isEmpty();
        assertThat(reversed.findPaths("a", "b", 2, 5, TraversalDirection.OUTGOING).getPaths()).hasSize(1);
        assertThat(reversed.streamPaths("b", "a", 2, 5).count()).isEqualTo(1);
    }

    // ================================================================
    // CYCLES
    // ================================================================

    @Test
    @DisplayName("Should report each dependency cycle once, starting at its smallest id")
    void testCircularDependencies() {
        // Given: a -> b -> c -> a and f <-> g over dependency edges, plus edges that must be ignored
        QueryEngine cyclic = dependencyGraph();

        // When
        List<DependencyCycle> cycles = cyclic.circularDependencies();

        // Then
        assertThat(cycles).extracting(DependencyCycle::getEntityIds)
            .containsExactly(List.of("a", "b", "c"), List.of("f", "g"));
        DependencyCycle first = cycles.get(0);
        assertThat(first.getEdges()).extracting(Relationship::getType)
            .containsExactly(RelationshipType.REQUIRES, RelationshipType.REQUIRES, RelationshipType.COMPATIBLE_WITH);
        for (int i = 0; i < first.length(); i++) {
            assertEquals(first.getEntityIds().get(i), first.getEdges().get(i).getSourceId());
            assertEquals(first.getEntityIds().get((i + 1) % first.length()), first.getEdges().get(i).getTargetId());
        }
    }

    @Test
    @DisplayName("Should flag entities whose dependency chain runs into a cycle")
    void testHasCircularDependency() {
        QueryEngine cyclic = dependencyGraph();

        assertTrue(cyclic.hasCircularDependency("c"));
        assertTrue(cyclic.hasCircularDependency("d"));
        assertFalse(cyclic.hasCircularDependency("e"));
        assertThrows(NotFoundException.class, () -> cyclic.hasCircularDependency("zzz"));
    }

    @Test
    @DisplayName("Should see the two-way compatibility of Slack and HTTP Request as a cycle")
    void testScenarioCycle() {
        assertThat(engine.circularDependencies()).extracting(DependencyCycle::getEntityIds)
            .contains(List.of("http-request", "slack"));
        assertFalse(engine.hasCircularDependency("discord"));
    }

    private static QueryEngine dependencyGraph() {
        SnapshotGraphStore store = GraphFixtures.store();
        for (String id : List.of("a", "b", "c", "d", "e", "f", "g")) {
            store.putEntity(GraphFixtures.node(id, id.toUpperCase(), EntityCategory.OTHER));
        }
        store.putEdge(GraphFixtures.link("a", RelationshipType.REQUIRES, "b", 0.9));
        store.putEdge(GraphFixtures.link("b", RelationshipType.REQUIRES, "c", 0.9));
        store.putEdge(GraphFixtures.link("c", RelationshipType.COMPATIBLE_WITH, "a", 0.8));
        store.putEdge(GraphFixtures.link("d", RelationshipType.REQUIRES, "a", 0.7));
        store.putEdge(GraphFixtures.link("e", RelationshipType.SIMILAR_TO, "a", 0.9));
        store.putEdge(GraphFixtures.link("e", RelationshipType.SOLVES, "d", 0.5));
        store.putEdge(GraphFixtures.link("f", RelationshipType.REQUIRES, "g", 0.6));
        store.putEdge(GraphFixtures.link("g", RelationshipType.REQUIRES, "f", 0.6));
        return GraphFixtures.pipeline(store, new HashingEmbeddingProvider(GraphFixtures.DIMENSION),
            GraphFixtures.properties()).engine();
    }
}
