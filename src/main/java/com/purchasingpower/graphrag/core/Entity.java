package com.purchasingpower.graphrag.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * A catalog building block in the graph.
 *
 * <p>Metadata is kept key-ordered so that serialization and hashing are stable.
 * The embedding is optional: entities whose vector could not be generated stay
 * searchable by keyword and traversal but are skipped by nearest-neighbour search.
 *
 * @since 1.0.0
 */
@Value
public class Entity {

    String id;
    String label;
    String description;
    EntityCategory category;
    Map<String, MetadataValue> metadata;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    EmbeddingVector embedding;

    @Builder(toBuilder = true)
    @Jacksonized
    private Entity(String id,
                   String label,
                   String description,
                   EntityCategory category,
                   Map<String, MetadataValue> metadata,
                   EmbeddingVector embedding) {
        this.id = id;
        this.label = label;
        this.description = description == null ? "" : description;
        this.category = category == null ? EntityCategory.OTHER : category;
        this.metadata = metadata == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(metadata));
        this.embedding = embedding;
    }

    public Entity withEmbedding(EmbeddingVector vector) {
        return toBuilder().embedding(vector).build();
    }

    public Optional<MetadataValue> metadataValue(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public List<String> stringList(String key) {
        MetadataValue value = metadata.get(key);
        return value == null ? List.of() : value.asList();
    }

    public Optional<String> string(String key) {
        MetadataValue value = metadata.get(key);
        return value == null ? Optional.empty() : Optional.of(value.asString());
    }

    public OptionalDouble number(String key) {
        MetadataValue value = metadata.get(key);
        if (value == null || value.kind() != MetadataValue.Kind.NUMBER) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value.asNumber());
    }

    /**
     * Empty when the rate was never observed.
     */
    public OptionalDouble successRate() {
        return number(MetadataKeys.SUCCESS_RATE);
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    /**
     * Text sent to the embedding provider.
     */
    public String embeddingText() {
        return description.isBlank() ? label : label + ": " + description;
    }
}
