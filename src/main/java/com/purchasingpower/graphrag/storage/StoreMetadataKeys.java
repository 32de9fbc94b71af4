package com.purchasingpower.graphrag.storage;

/**
 * Store-wide metadata keys written on every build.
 */
public final class StoreMetadataKeys {

    public static final String BUILD_TIMESTAMP = "build_timestamp";
    public static final String SCHEMA_VERSION = "schema_version";
    public static final String ENTITIES_TOTAL = "entities_total";
    public static final String RELATIONSHIPS_TOTAL = "relationships_total";
    public static final String EMBEDDINGS_TOTAL = "embeddings_total";
    public static final String EMBEDDING_MODEL = "embedding_model";
    public static final String EMBEDDING_DIMENSION = "embedding_dimension";
    public static final String CATALOG_SOURCE = "catalog_source";

    private StoreMetadataKeys() {
    }
}
