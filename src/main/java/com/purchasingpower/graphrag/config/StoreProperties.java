package com.purchasingpower.graphrag.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StoreProperties {

    /**
     * Directory holding the committed snapshot and the query log. Memory only when unset.
     */
    private String directory;

    @NotBlank
    private String schemaVersion = "1.0.0";

    /**
     * Query traces kept in memory for {@code recentQueries}.
     */
    @Min(0)
    private int maxQueryTraces = 10_000;

    /**
     * The query log rolls to {@code query-log.1.jsonl} past this size; 0 never rolls.
     */
    @Min(0)
    private long queryLogMaxBytes = 10L * 1024 * 1024;

    /**
     * Traces waiting for the log writer before new ones are dropped from the file.
     */
    @Min(1)
    private int queryLogQueueCapacity = 1_000;
}
