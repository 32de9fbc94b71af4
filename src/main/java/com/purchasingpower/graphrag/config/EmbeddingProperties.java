package com.purchasingpower.graphrag.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Embedding provider settings.
 *
 * <p>{@code provider} is either {@code hashing} (deterministic, in-process) or
 * {@code ollama} (LangChain4j client against a local Ollama server).
 */
@Data
public class EmbeddingProperties {

    @NotBlank
    private String provider = "hashing";

    @NotBlank
    private String modelName = "nomic-embed-text";

    private String baseUrl = "http://localhost:11434";

    @Min(8)
    private int dimension = 384;

    @NotNull
    private Duration queryTimeout = Duration.ofSeconds(3);

    @NotNull
    private Duration buildTimeout = Duration.ofSeconds(30);

    @Min(1)
    private int batchSize = 32;

    @Min(1)
    private int executorThreads = 4;
}
