package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.GraphFixtures;
import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.knowledge.CatalogPattern;
import com.purchasingpower.graphrag.knowledge.CatalogRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * ════════════════════════════════════════════════════════════════════════════
 * RELATIONSHIP INFERENCE TEST
 * ════════════════════════════════════════════════════════════════════════════
 *
 * Edges come from shared categories, workflow patterns, declared requirements,
 * the known-pairs table and embedding similarity. Every endpoint must be an
 * extracted entity and every strength must stay within [0, 1].
 *
 * ════════════════════════════════════════════════════════════════════════════
 */
@DisplayName("Relationship Inferrer Tests")
class RelationshipInferrerTest {

    private final GraphRagProperties properties = GraphFixtures.properties();
    private final EntityExtractor extractor = new EntityExtractor(GraphFixtures.templates(), properties);
    private final HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider(GraphFixtures.DIMENSION);
    private final RelationshipInferrer inferrer = new RelationshipInferrer(GraphFixtures.templates(), properties);

    @Test
    @DisplayName("Should link messaging entities by category and pattern members by usage")
    void testMessagingScenario() {
        // Given: A and B are messaging, C is http, one pattern [A, C]
        List<Entity> entities = entities(
            record("slack", "Slack", "Send a chat message to Slack channels and users.", "messaging"),
            record("discord", "Discord", "Send a chat message to a Discord server channel.", "messaging"),
            record("http-request", "HTTP Request", "Make HTTP requests to any REST API endpoint.", "http"));
        List<CatalogPattern> patterns = List.of(pattern("alerts", "slack", "http-request"));

        // When
        List<Relationship> edges = inferrer.infer(entities, patterns, Map.of());

        // Then
        assertThat(find(edges, "slack", RelationshipType.BELONGS_TO_CATEGORY, "discord")).isPresent();
        assertThat(find(edges, "slack", RelationshipType.USED_IN_PATTERN, "http-request")).isPresent();
        assertThat(find(edges, "slack", RelationshipType.COMPATIBLE_WITH, "http-request")).isPresent();
        assertThat(find(edges, "discord", RelationshipType.USED_IN_PATTERN, "http-request")).isEmpty();

        double similarity = entities.get(0).getEmbedding().cosine(entities.get(1).getEmbedding());
        assertEquals(similarity > properties.getBuilder().getSimilarToThreshold(),
            find(edges, "slack", RelationshipType.SIMILAR_TO, "discord").isPresent());
    }

    @Test
    @DisplayName("Should only reference extracted entities and keep strengths in range")
    void testNoDanglingEdges() {
        // Given: Patterns and requirements naming ids that do not exist
        List<Entity> entities = entities(
            record("filter", "Filter", "Keep only items that match conditions.", null),
            record("set", "Set", "Set fields on items.", "data"),
            record("postgres", "Postgres", "Run SQL queries.", "database"));
        List<CatalogPattern> patterns = List.of(pattern("digest", "postgres", "ghost", "set", "phantom"));
        Map<String, List<String>> requires = Map.of(
            "filter", List.of("set", "ghost", "filter"),
            "phantom", List.of("set"));

        // When
        List<Relationship> edges = inferrer.infer(entities, patterns, requires);

        // Then
        Set<String> ids = entities.stream().map(Entity::getId).collect(Collectors.toSet());
        assertThat(edges).isNotEmpty().allSatisfy(edge -> {
            assertThat(ids).contains(edge.getSourceId(), edge.getTargetId());
            assertThat(edge.getStrength()).isBetween(0.0, 1.0);
            assertThat(edge.getSourceId()).isNotEqualTo(edge.getTargetId());
            assertThat(edge.getReasoning()).isNotBlank();
        });
        assertThat(find(edges, "filter", RelationshipType.REQUIRES, "set")).isPresent();
        assertThat(edges).filteredOn(e -> e.getType() == RelationshipType.REQUIRES).hasSize(1);
        assertThat(find(edges, "postgres", RelationshipType.COMPATIBLE_WITH, "set")).isPresent();
    }

    @Test
    @DisplayName("Should apply the known-pairs table with its mapping and pitfalls")
    void testRulePairs() {
        List<Entity> entities = entities(
            record("http-request", "HTTP Request", "Make HTTP requests.", "http"),
            record("set", "Set", "Set fields on items.", "data"));

        List<Relationship> edges = inferrer.infer(entities, List.of(), Map.of());

        Relationship edge = find(edges, "http-request", RelationshipType.COMPATIBLE_WITH, "set").orElseThrow();
        assertThat(edge.getStrength()).isGreaterThanOrEqualTo(0.95);
        assertThat(edge.getHints().getConfigMapping()).isEqualTo("Parse JSON from HTTP into variables");
        assertThat(edge.getHints().getPitfalls()).contains("JSON might be string-escaped");
        assertThat(edge.getReasoning()).contains("HTTP response needs formatting before use");
    }

    @Test
    @DisplayName("Should mark later pattern steps as triggered by a leading trigger")
    void testTriggeredBy() {
        List<Entity> entities = entities(
            record("schedule-trigger", "Schedule Trigger", "Start a workflow on a cron schedule.", "trigger"),
            record("http-request", "HTTP Request", "Make HTTP requests.", "http"));

        List<Relationship> edges = inferrer.infer(entities,
            List.of(pattern("poll", "schedule-trigger", "http-request")), Map.of());

        Relationship edge = find(edges, "http-request", RelationshipType.TRIGGERED_BY, "schedule-trigger").orElseThrow();
        assertThat(edge.getSourceId()).isEqualTo("http-request");
        assertThat(edge.getReasoning()).contains("Schedule Trigger");
    }

    @Test
    @DisplayName("Should not group entities through the fallback category")
    void testOtherCategoryNotLinked() {
        List<Entity> entities = entities(
            record("frobnicator", "Frobnicator", "Frobnicates widgets.", null),
            record("wobbler", "Wobbler", "Wobbles gizmos.", null));

        List<Relationship> edges = inferrer.infer(entities, List.of(), Map.of());

        assertThat(edges).noneMatch(e -> e.getType() == RelationshipType.BELONGS_TO_CATEGORY);
    }

    @Test
    @DisplayName("Should cap the number of edges touching any entity")
    void testFanOutCap() {
        // Given: Six messaging entities would form fifteen category edges
        properties.getBuilder().setMaxEdgesPerEntity(2);
        RelationshipInferrer capped = new RelationshipInferrer(GraphFixtures.templates(), properties);
        List<Entity> entities = entities(
            record("slack", "Slack", "Chat.", "messaging"),
            record("discord", "Discord", "Chat.", "messaging"),
            record("telegram", "Telegram", "Chat.", "messaging"),
            record("teams", "Teams", "Chat.", "messaging"),
            record("mattermost", "Mattermost", "Chat.", "messaging"),
            record("email-send", "Send Email", "Mail.", "messaging"));

        // When
        List<Relationship> edges = capped.infer(entities, List.of(), Map.of());

        // Then
        Map<String, Integer> degree = new HashMap<>();
        edges.forEach(e -> {
            degree.merge(e.getSourceId(), 1, Integer::sum);
            degree.merge(e.getTargetId(), 1, Integer::sum);
        });
        assertThat(degree.values()).allMatch(d -> d <= 2);
        assertThat(edges).isNotEmpty();
    }

    @Test
    @DisplayName("Should infer the same edges in the same order on every run")
    void testDeterministic() {
        List<Entity> entities = entities(
            record("slack", "Slack", "Send a chat message to Slack channels and users.", "messaging"),
            record("set", "Set", "Set fields on items.", "data"),
            record("http-request", "HTTP Request", "Make HTTP requests.", "http"));
        List<CatalogPattern> patterns = List.of(pattern("flow", "http-request", "set", "slack"));

        assertThat(inferrer.infer(entities, patterns, Map.of()))
            .containsExactlyElementsOf(inferrer.infer(entities, patterns, Map.of()));
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private List<Entity> entities(CatalogRecord... records) {
        return extractor.extractAll(List.of(records)).entities().stream()
            .map(e -> e.withEmbedding(embeddings.embed(e.embeddingText())))
            .toList();
    }

    private static CatalogRecord record(String id, String label, String description, String category) {
        return CatalogRecord.builder().id(id).label(label).description(description).category(category).build();
    }

    private static CatalogPattern pattern(String id, String... nodes) {
        return CatalogPattern.builder().id(id).name(id).nodes(List.of(nodes)).build();
    }

    /**
     * Looks an edge up the way the store does: symmetric types match either orientation.
     */
    static Optional<Relationship> find(List<Relationship> edges, String source, RelationshipType type, String target) {
        return edges.stream()
            .filter(e -> e.getType() == type)
            .filter(e -> (e.getSourceId().equals(source) && e.getTargetId().equals(target))
                || (type.isSymmetric() && e.getSourceId().equals(target) && e.getTargetId().equals(source)))
            .findFirst();
    }
}
