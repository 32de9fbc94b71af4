package com.purchasingpower.graphrag.core;

/**
 * Well-known entity metadata keys.
 */
public final class MetadataKeys {

    public static final String USE_CASES = "use_cases";
    public static final String PREREQUISITES = "prerequisites";
    public static final String PITFALLS = "pitfalls";
    public static final String TIPS = "tips";
    public static final String KEYWORDS = "keywords";
    public static final String CONFIGURATION_PRESETS = "configuration_presets";
    public static final String PROPERTIES = "properties";
    public static final String OPERATIONS = "operations";
    public static final String COMPLEXITY = "complexity";
    public static final String LEARNING_CURVE = "learning_curve";

    // Absent means unknown, never zero
    public static final String SUCCESS_RATE = "success_rate";
    public static final String USAGE_COUNT = "usage_count";
    public static final String RATING = "rating";

    private MetadataKeys() {
    }
}
