package com.purchasingpower.graphrag.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Root of the {@code graphrag.*} configuration tree.
 *
 * <p>Every nested section carries working defaults, so components can also be
 * constructed directly with {@code new GraphRagProperties()}.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "graphrag")
public class GraphRagProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StoreProperties store = new StoreProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private BuilderProperties builder = new BuilderProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private QueryProperties query = new QueryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CatalogProperties catalog = new CatalogProperties();
}
