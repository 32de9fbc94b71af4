package com.purchasingpower.graphrag.config;

import com.purchasingpower.graphrag.knowledge.BuildResult;
import com.purchasingpower.graphrag.knowledge.GraphBuilder;
import com.purchasingpower.graphrag.knowledge.impl.CatalogLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Builds the graph from {@code graphrag.catalog.path} once the context is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "graphrag.catalog", name = "build-on-startup", havingValue = "true")
public class CatalogBootstrapRunner implements ApplicationRunner {

    private final CatalogLoader catalogLoader;
    private final GraphBuilder graphBuilder;
    private final GraphRagProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String path = properties.getCatalog().getPath();
        if (path == null || path.isBlank()) {
            log.warn("⚠️ graphrag.catalog.build-on-startup is set but graphrag.catalog.path is empty, skipping build");
            return;
        }
        BuildResult result = graphBuilder.build(catalogLoader.load(path));
        if (result.isSuccess()) {
            log.info("🚀 Startup build finished: {} entities, {} relationships in {}ms",
                result.getEntitiesCreated(), result.getRelationshipsCreated(), result.getDurationMs());
        } else {
            log.error("❌ Startup build failed: {}", result.getErrors());
        }
    }
}
