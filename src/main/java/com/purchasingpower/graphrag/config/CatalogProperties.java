package com.purchasingpower.graphrag.config;

import lombok.Data;

@Data
public class CatalogProperties {

    /**
     * Catalog JSON used by the startup build. Accepts {@code classpath:} locations.
     */
    private String path;

    private boolean buildOnStartup = false;
}
