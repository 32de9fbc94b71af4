package com.purchasingpower.graphrag.search.impl;

import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.MetadataKeys;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.RelationshipHints;
import com.purchasingpower.graphrag.search.Alternative;
import com.purchasingpower.graphrag.search.Explanation;
import com.purchasingpower.graphrag.search.GraphPath;
import com.purchasingpower.graphrag.search.ScoredEntity;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.template.TemplateLibrary;
import com.purchasingpower.graphrag.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Renders explanations from the "explanations" template set.
 *
 * <p>Only text already stored on entities and edges is used, so the same
 * snapshot and query always produce the same explanation.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExplanationGenerator {

    static final String TEMPLATE_SET = "explanations";

    private final TemplateLibrary templates;

    /**
     * Why {@code result} answers {@code query}: direct-hit evidence first, then
     * the edges that carried its graph boost.
     */
    public Explanation explain(GraphSnapshot snapshot, String query, ScoredEntity result) {
        Entity entity = result.getEntity();
        List<String> reasons = new ArrayList<>();

        if (!result.getMatchedTerms().isEmpty()) {
            reasons.add(render("matched-terms", Map.of("terms", String.join(", ", result.getMatchedTerms()))));
        }
        if (result.getSemanticScore() > 0) {
            reasons.add(render("semantic", Map.of("similarity", format(result.getSemanticScore()))));
        }
        List<String> useCases = matchingUseCases(entity, query);
        if (!useCases.isEmpty()) {
            reasons.add(render("use-cases", Map.of("useCases", String.join("; ", useCases))));
        }
        reasons.add(render("category", Map.of("label", entity.getLabel(), "category", entity.getCategory().id())));

        for (Relationship edge : result.getGraphEvidence()) {
            String otherId = edge.other(entity.getId());
            String other = snapshot.findEntity(otherId).map(Entity::getLabel).orElse(otherId);
            reasons.add(render("graph-link", Map.of(
                "other", other,
                "type", edge.getType().wireName(),
                "reasoning", edge.getReasoning())));
        }

        List<String> caveats = new ArrayList<>();
        entity.stringList(MetadataKeys.PREREQUISITES)
            .forEach(p -> caveats.add(render("prerequisite", Map.of("text", p))));
        entity.stringList(MetadataKeys.PITFALLS)
            .forEach(p -> caveats.add(render("pitfall", Map.of("text", p))));

        List<String> tips = new ArrayList<>();
        entity.stringList(MetadataKeys.TIPS).forEach(t -> tips.add(render("tip", Map.of("text", t))));
        OptionalDouble successRate = entity.successRate();
        if (successRate.isPresent()) {
            tips.add(render("success-rate", Map.of("rate", format(successRate.getAsDouble()))));
        }

        return Explanation.builder()
            .subjectId(entity.getId())
            .query(query)
            .summary(render("summary", Map.of(
                "label", entity.getLabel(),
                "category", entity.getCategory().id(),
                "description", entity.getDescription())))
            .reasons(List.copyOf(reasons))
            .caveats(List.copyOf(caveats))
            .tips(List.copyOf(tips))
            .evidence(result.getGraphEvidence())
            .build();
    }

    /**
     * One step per edge, plus pair pitfalls and data mappings carried on the edges.
     */
    public Explanation explainPath(GraphSnapshot snapshot, GraphPath path) {
        String source = label(snapshot, path.source());
        if (path.hops() == 0) {
            return Explanation.builder()
                .subjectId(path.source())
                .summary(render("path-trivial", Map.of("source", source)))
                .build();
        }

        List<String> steps = new ArrayList<>();
        List<String> caveats = new ArrayList<>();
        List<String> tips = new ArrayList<>();
        List<String> ids = path.getEntityIds();
        for (int i = 0; i < path.hops(); i++) {
            Relationship edge = path.getEdges().get(i);
            String from = label(snapshot, ids.get(i));
            String to = label(snapshot, ids.get(i + 1));
            steps.add(render("path-step", Map.of(
                "from", from,
                "to", to,
                "type", edge.getType().wireName(),
                "strength", format(edge.getStrength()),
                "reasoning", edge.getReasoning())));

            RelationshipHints hints = edge.getHints();
            if (hints == null) {
                continue;
            }
            if (hints.getPitfalls() != null) {
                hints.getPitfalls().forEach(p -> caveats.add(render("edge-pitfall", Map.of("from", from, "to", to, "text", p))));
            }
            if (hints.getConfigMapping() != null && !hints.getConfigMapping().isBlank()) {
                tips.add(render("edge-mapping", Map.of("from", from, "to", to, "text", hints.getConfigMapping())));
            }
        }

        return Explanation.builder()
            .subjectId(path.source())
            .summary(render("path-summary", Map.of(
                "source", source,
                "target", label(snapshot, path.last()),
                "hops", path.hops(),
                "confidence", format(path.confidence()))))
            .reasons(List.copyOf(steps))
            .caveats(List.copyOf(caveats))
            .tips(List.copyOf(tips))
            .evidence(path.getEdges())
            .build();
    }

    /**
     * Lists the alternatives in the order given, with prerequisites the
     * original does not already have.
     */
    public Explanation explainAlternatives(GraphSnapshot snapshot, Entity original, List<Alternative> alternatives) {
        if (alternatives.isEmpty()) {
            return Explanation.builder()
                .subjectId(original.getId())
                .summary(render("alternatives-none", Map.of("label", original.getLabel())))
                .build();
        }

        Set<String> knownPrerequisites = new HashSet<>(original.stringList(MetadataKeys.PREREQUISITES));
        List<String> names = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        List<String> caveats = new ArrayList<>();
        List<String> tips = new ArrayList<>();
        List<Relationship> evidence = new ArrayList<>();
        for (Alternative alternative : alternatives) {
            Entity entity = alternative.getEntity();
            Relationship via = alternative.getVia();
            names.add(entity.getLabel());
            evidence.add(via);
            reasons.add(render("alternative", Map.of(
                "label", entity.getLabel(),
                "category", entity.getCategory().id(),
                "type", via.getType().wireName(),
                "strength", format(via.getStrength()),
                "reasoning", via.getReasoning())));
            entity.stringList(MetadataKeys.PREREQUISITES).stream()
                .filter(p -> !knownPrerequisites.contains(p))
                .forEach(p -> caveats.add(render("alternative-prerequisite", Map.of("label", entity.getLabel(), "text", p))));
            entity.successRate().ifPresent(rate -> tips.add(render("alternative-success-rate", Map.of(
                "label", entity.getLabel(),
                "rate", format(rate)))));
        }

        return Explanation.builder()
            .subjectId(original.getId())
            .summary(render("alternatives-summary", Map.of(
                "label", original.getLabel(),
                "names", String.join(", ", names))))
            .reasons(List.copyOf(reasons))
            .caveats(List.copyOf(caveats))
            .tips(List.copyOf(tips))
            .evidence(List.copyOf(evidence))
            .build();
    }

    /**
     * Path explanation of the chosen route, plus the source's pitfalls and one
     * mapping step per hop.
     */
    public Explanation explainIntegration(GraphSnapshot snapshot, String sourceId, String targetId,
                                          int maxHops, Optional<GraphPath> route) {
        if (route.isEmpty()) {
            return Explanation.builder()
                .subjectId(sourceId)
                .summary(render("integration-none", Map.of(
                    "source", label(snapshot, sourceId),
                    "target", label(snapshot, targetId),
                    "hops", maxHops)))
                .build();
        }

        GraphPath path = route.get();
        Explanation steps = explainPath(snapshot, path);
        List<String> labels = path.getEntityIds().stream().map(id -> label(snapshot, id)).toList();

        List<String> caveats = new ArrayList<>();
        snapshot.entity(sourceId).stringList(MetadataKeys.PITFALLS)
            .forEach(p -> caveats.add(render("pitfall", Map.of("text", p))));
        caveats.addAll(steps.getCaveats());

        List<String> tips = new ArrayList<>(steps.getTips());
        for (int i = 0; i < path.hops(); i++) {
            tips.add(render("integration-step", Map.of("from", labels.get(i), "to", labels.get(i + 1))));
        }

        return steps.toBuilder()
            .summary(render("integration-summary", Map.of(
                "route", String.join(" -> ", labels),
                "confidence", format(path.confidence()))))
            .caveats(List.copyOf(caveats))
            .tips(List.copyOf(tips))
            .build();
    }

    /**
     * Use cases sharing at least one token with the query.
     */
    static List<String> matchingUseCases(Entity entity, String query) {
        Set<String> queryTerms = new HashSet<>(TextUtils.tokenize(query));
        List<String> matches = new ArrayList<>();
        for (String useCase : entity.stringList(MetadataKeys.USE_CASES)) {
            if (TextUtils.tokenize(useCase).stream().anyMatch(queryTerms::contains)) {
                matches.add(useCase);
            }
        }
        return matches;
    }

    private String render(String template, Map<String, ?> variables) {
        return templates.render(TEMPLATE_SET, template, variables);
    }

    private static String label(GraphSnapshot snapshot, String id) {
        return snapshot.findEntity(id).map(Entity::getLabel).orElse(id);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
