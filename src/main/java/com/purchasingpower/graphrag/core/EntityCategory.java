package com.purchasingpower.graphrag.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of catalog categories. Unknown names map to {@link #OTHER}.
 *
 * @since 1.0.0
 */
public enum EntityCategory {

    MESSAGING("messaging", "communication", "chat"),
    DATA("data", "transform", "data-transformation"),
    DATABASE("database", "db", "sql"),
    TRIGGER("trigger", "triggers", "schedule"),
    FILE("file", "files", "storage"),
    HTTP("http", "api", "webhook"),
    CLOUD("cloud"),
    FLOW_CONTROL("flow-control", "flow", "core", "logic"),
    AI("ai", "llm", "ml"),
    SOCIAL("social"),
    CRM("crm", "sales"),
    ANALYTICS("analytics", "reporting"),
    OTHER("other");

    private final String id;
    private final List<String> aliases;

    EntityCategory(String id, String... aliases) {
        this.id = id;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String id() {
        return id;
    }

    public List<String> aliases() {
        return aliases;
    }

    @JsonCreator
    public static EntityCategory fromId(String value) {
        return tryParse(value).orElse(OTHER);
    }

    /**
     * Strict lookup by id or alias; empty when the name is unknown.
     */
    public static Optional<EntityCategory> tryParse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (EntityCategory category : values()) {
            if (category.id.equals(normalized) || category.aliases.contains(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
