package com.purchasingpower.graphrag.config;

import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.knowledge.EmbeddingProvider;
import com.purchasingpower.graphrag.knowledge.impl.HashingEmbeddingProvider;
import com.purchasingpower.graphrag.knowledge.impl.LangChain4jEmbeddingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Locale;

/**
 * Embedding provider selection and the pool that runs embedding calls.
 */
@Slf4j
@Configuration
public class EmbeddingConfig {

    @Bean
    public EmbeddingProvider embeddingProvider(GraphRagProperties properties) {
        EmbeddingProperties embedding = properties.getEmbedding();
        EmbeddingProvider provider = switch (embedding.getProvider().toLowerCase(Locale.ROOT)) {
            case "hashing" -> new HashingEmbeddingProvider(embedding.getDimension());
            case "ollama" -> new LangChain4jEmbeddingProvider(
                embedding.getBaseUrl(),
                embedding.getModelName(),
                embedding.getDimension(),
                embedding.getBuildTimeout());
            default -> throw new ValidationException("Unknown embedding provider: " + embedding.getProvider());
        };
        log.info("✅ Embedding provider configured: model={}, dimension={}", provider.modelId(), provider.dimension());
        return provider;
    }

    @Bean(name = "embeddingExecutor")
    public ThreadPoolTaskExecutor embeddingExecutor(GraphRagProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int threads = properties.getEmbedding().getExecutorThreads();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);

        // Bounded so a stalled provider cannot pile up unbounded work
        executor.setQueueCapacity(threads * 25);

        executor.setThreadNamePrefix("embedding-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("✅ Embedding executor configured: threads={}, queue={}",
            executor.getCorePoolSize(),
            executor.getQueueCapacity());

        return executor;
    }
}
