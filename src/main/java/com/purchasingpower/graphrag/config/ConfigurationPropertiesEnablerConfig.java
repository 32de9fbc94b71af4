package com.purchasingpower.graphrag.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link GraphRagProperties} for binding from application.yml.
 *
 * <p>The nested groups ({@link StoreProperties}, {@link EmbeddingProperties},
 * {@link RetryProperties}, {@link BuilderProperties}, {@link QueryProperties},
 * {@link CatalogProperties}) bind through the root class.
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GraphRagProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
    // Binding is handled by @EnableConfigurationProperties.
}
