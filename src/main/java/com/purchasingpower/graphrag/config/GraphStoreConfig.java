package com.purchasingpower.graphrag.config;

import com.purchasingpower.graphrag.knowledge.EmbeddingProvider;
import com.purchasingpower.graphrag.storage.SnapshotPersistence;
import com.purchasingpower.graphrag.storage.impl.InMemorySnapshotPersistence;
import com.purchasingpower.graphrag.storage.impl.JsonSnapshotPersistence;
import com.purchasingpower.graphrag.storage.impl.SnapshotGraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;

@Slf4j
@Configuration
public class GraphStoreConfig {

    @Bean
    public SnapshotPersistence snapshotPersistence(GraphRagProperties properties,
                                                   @Qualifier("queryLogExecutor") ThreadPoolTaskExecutor queryLogExecutor) {
        StoreProperties store = properties.getStore();
        String directory = store.getDirectory();
        if (directory == null || directory.isBlank()) {
            log.info("Graph store directory not set, keeping the graph in memory only");
            return new InMemorySnapshotPersistence();
        }
        log.info("Graph store directory: {}", directory);
        return new JsonSnapshotPersistence(Path.of(directory), queryLogExecutor, store.getQueryLogMaxBytes());
    }

    /**
     * Single writer for the query log, so appends stay ordered and off the search path.
     */
    @Bean(name = "queryLogExecutor")
    public ThreadPoolTaskExecutor queryLogExecutor(GraphRagProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(properties.getStore().getQueryLogQueueCapacity());
        executor.setThreadNamePrefix("query-log-");

        // Flush pending traces on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();

        log.info("✅ Query log executor configured: queue={}", executor.getQueueCapacity());
        return executor;
    }

    /**
     * The store's dimension follows the configured provider, so a persisted
     * graph built with another model is detected on open.
     */
    @Bean
    public SnapshotGraphStore graphStore(SnapshotPersistence persistence,
                                         EmbeddingProvider embeddingProvider,
                                         GraphRagProperties properties) {
        StoreProperties store = properties.getStore();
        SnapshotGraphStore graphStore = new SnapshotGraphStore(
            embeddingProvider.dimension(),
            store.getSchemaVersion(),
            store.getMaxQueryTraces(),
            persistence);
        graphStore.open();
        return graphStore;
    }
}
