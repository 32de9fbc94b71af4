package com.purchasingpower.graphrag.knowledge.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.knowledge.Catalog;
import com.purchasingpower.graphrag.knowledge.CatalogPattern;
import com.purchasingpower.graphrag.knowledge.CatalogRecord;
import com.purchasingpower.graphrag.util.JsonMappers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses catalog JSON.
 *
 * <p>Accepts either a bare array of records or an object with {@code records}
 * (alias {@code nodes}) and {@code patterns}. A malformed record is reported and
 * skipped; only an unreadable document fails the load. Pattern membership
 * declared on records is merged into the pattern list.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class CatalogLoader {

    private final ObjectMapper mapper = JsonMappers.canonical();
    private final DefaultResourceLoader resourceLoader = new DefaultResourceLoader();

    /**
     * Load from a Spring resource location ({@code classpath:...}, {@code file:...}) or a plain path.
     */
    public Catalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            Path path = Path.of(location);
            if (Files.exists(path)) {
                return load(path);
            }
            throw new ValidationException("Catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(mapper.readTree(in), location);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Catalog " + location + " is not valid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog " + location, e);
        }
    }

    public Catalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(mapper.readTree(in), path.toString());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Catalog " + path + " is not valid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog " + path, e);
        }
    }

    public Catalog parse(JsonNode root, String source) {
        JsonNode recordsNode;
        JsonNode patternsNode = null;
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new ValidationException("Catalog " + source + " is empty");
        }
        if (root.isArray()) {
            recordsNode = root;
        } else if (root.isObject()) {
            recordsNode = root.has("records") ? root.get("records") : root.get("nodes");
            patternsNode = root.get("patterns");
        } else {
            throw new ValidationException("Catalog " + source + " must be an array or an object");
        }

        List<CatalogRecord> records = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        if (recordsNode != null && recordsNode.isArray()) {
            int index = 0;
            for (JsonNode node : recordsNode) {
                try {
                    records.add(mapper.treeToValue(node, CatalogRecord.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    String reason = "record #" + index + ": " + e.getMessage().lines().findFirst().orElse("malformed");
                    rejected.add(reason);
                    log.warn("⚠️ Rejected catalog {}", reason);
                }
                index++;
            }
        }

        List<CatalogPattern> patterns = new ArrayList<>();
        if (patternsNode != null && patternsNode.isArray()) {
            int index = 0;
            for (JsonNode node : patternsNode) {
                try {
                    patterns.add(mapper.treeToValue(node, CatalogPattern.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    rejected.add("pattern #" + index + ": malformed");
                    log.warn("⚠️ Rejected catalog pattern #{}: {}", index, e.getMessage());
                }
                index++;
            }
        }

        Catalog catalog = Catalog.builder()
            .source(source)
            .records(records)
            .patterns(mergePatterns(patterns, records))
            .rejected(rejected)
            .build();
        log.info("📥 Loaded catalog {}: {} records, {} patterns, {} rejected",
            source, records.size(), catalog.getPatterns().size(), rejected.size());
        return catalog;
    }

    /**
     * Adds records that name a pattern to that pattern's members. Explicit
     * member order comes first; record-declared members follow in catalog order.
     */
    static List<CatalogPattern> mergePatterns(List<CatalogPattern> declared, List<CatalogRecord> records) {
        Map<String, CatalogPattern> byId = new LinkedHashMap<>();
        Map<String, Set<String>> members = new LinkedHashMap<>();
        for (CatalogPattern pattern : declared) {
            String key = pattern.getId() != null ? pattern.getId() : pattern.getName();
            if (key == null) {
                continue;
            }
            byId.put(key, pattern);
            members.computeIfAbsent(key, k -> new LinkedHashSet<>()).addAll(pattern.getNodes());
        }
        for (CatalogRecord record : records) {
            if (record.getId() == null) {
                continue;
            }
            for (String patternRef : record.getPatterns()) {
                String key = resolvePattern(byId, patternRef);
                byId.computeIfAbsent(key, k -> CatalogPattern.builder().id(k).name(k).build());
                members.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(record.getId());
            }
        }
        List<CatalogPattern> merged = new ArrayList<>();
        byId.forEach((key, pattern) -> merged.add(pattern.toBuilder()
            .id(key)
            .nodes(List.copyOf(members.getOrDefault(key, Set.of())))
            .build()));
        return merged;
    }

    private static String resolvePattern(Map<String, CatalogPattern> byId, String ref) {
        if (byId.containsKey(ref)) {
            return ref;
        }
        for (Map.Entry<String, CatalogPattern> entry : byId.entrySet()) {
            if (ref.equalsIgnoreCase(entry.getValue().getName())) {
                return entry.getKey();
            }
        }
        return ref;
    }
}
