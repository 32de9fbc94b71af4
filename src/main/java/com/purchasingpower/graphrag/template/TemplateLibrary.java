package com.purchasingpower.graphrag.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.graphrag.exception.GraphRagException;
import com.purchasingpower.graphrag.util.JsonMappers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Template Library
 *
 * Loads parameterised text templates from YAML files and renders them with Mustache.
 * Reasoning attached to inferred edges and every explanation are produced here,
 * so the wording lives in {@code classpath:templates/*.yaml} rather than in code.
 *
 * Usage:
 * String text = templates.render("reasoning", "compatible-with", Map.of(
 *     "source", "Slack",
 *     "target", "HTTP Request"
 * ));
 */
@Slf4j
@Service
public class TemplateLibrary {

    static final String DEFAULT_LOCATION = "classpath:templates/*.yaml";

    private final ObjectMapper yamlMapper = JsonMappers.yaml();
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, TemplateSet> sets = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    public TemplateLibrary() {
        this(DEFAULT_LOCATION);
    }

    public TemplateLibrary(String locationPattern) {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            for (Resource resource : resolver.getResources(locationPattern)) {
                try (InputStream in = resource.getInputStream()) {
                    TemplateSet set = yamlMapper.readValue(in, TemplateSet.class);
                    sets.put(set.getName(), set);
                    log.info("Loaded template set: {} ({} templates, version {})",
                        set.getName(), set.getTemplates().size(), set.getVersion());
                }
            }
        } catch (IOException e) {
            log.error("Failed to load templates from {}", locationPattern, e);
            throw new GraphRagException("Template library initialization failed", e);
        }
        log.info("Loaded {} template sets", sets.size());
    }

    /**
     * Render a template with variables.
     *
     * @throws GraphRagException when the set or template does not exist
     */
    public String render(String setName, String templateName, Map<String, ?> variables) {
        String key = setName + "/" + templateName;
        Mustache mustache = compiled.computeIfAbsent(key, k -> mustacheFactory.compile(
            new StringReader(source(setName, templateName)), k));
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString().trim();
    }

    public boolean has(String setName, String templateName) {
        TemplateSet set = sets.get(setName);
        return set != null && set.getTemplates().containsKey(templateName);
    }

    private String source(String setName, String templateName) {
        TemplateSet set = sets.get(setName);
        if (set == null) {
            throw new GraphRagException("Template set not found: " + setName);
        }
        String text = set.getTemplates().get(templateName);
        if (text == null) {
            throw new GraphRagException("Template not found: " + setName + "/" + templateName);
        }
        return text;
    }
}
