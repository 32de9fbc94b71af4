package com.purchasingpower.graphrag.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.graphrag.storage.QueryTrace;
import com.purchasingpower.graphrag.storage.SnapshotCodec;
import com.purchasingpower.graphrag.storage.SnapshotDocument;
import com.purchasingpower.graphrag.storage.SnapshotPersistence;
import com.purchasingpower.graphrag.util.JsonMappers;
import com.purchasingpower.graphrag.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * File-backed persistence: one verified snapshot document plus an append-only
 * JSON-lines query log, both under the configured store directory.
 *
 * <p>Query traces are serialised on the caller's thread and written by the
 * query-log executor, so searches never wait on the disk. When the executor's
 * backlog is full the trace is dropped from the file with a warning. The log
 * is rolled to {@value #ROLLED_QUERY_LOG_FILE} once it would pass the size cap;
 * only one rolled file is kept.
 *
 * @since 1.0.0
 */
@Slf4j
public class JsonSnapshotPersistence implements SnapshotPersistence {

    static final String SNAPSHOT_FILE = "graph-snapshot.json";
    static final String QUERY_LOG_FILE = "query-log.jsonl";
    static final String ROLLED_QUERY_LOG_FILE = "query-log.1.jsonl";
    static final long DEFAULT_QUERY_LOG_MAX_BYTES = 10L * 1024 * 1024;

    private final Path directory;
    private final Executor queryLogExecutor;
    private final long queryLogMaxBytes;
    private final SnapshotCodec codec = new SnapshotCodec();
    private final ObjectMapper mapper = JsonMappers.canonical();

    /**
     * Writes query traces on the calling thread.
     */
    public JsonSnapshotPersistence(Path directory) {
        this(directory, Runnable::run, DEFAULT_QUERY_LOG_MAX_BYTES);
    }

    /**
     * @param queryLogMaxBytes size at which the query log rolls; 0 or less never rolls
     */
    public JsonSnapshotPersistence(Path directory, Executor queryLogExecutor, long queryLogMaxBytes) {
        this.directory = directory;
        this.queryLogExecutor = queryLogExecutor;
        this.queryLogMaxBytes = queryLogMaxBytes;
    }

    public Path snapshotFile() {
        return directory.resolve(SNAPSHOT_FILE);
    }

    @Override
    public Optional<SnapshotDocument> load() {
        Path file = snapshotFile();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        log.info("📂 Loading graph snapshot from {}", file);
        return Optional.of(codec.read(file));
    }

    @Override
    public void save(SnapshotDocument document) {
        codec.write(document, snapshotFile());
    }

    @Override
    public void appendQuery(QueryTrace trace) {
        String line;
        try {
            line = mapper.writeValueAsString(trace) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise query trace", e);
        }
        try {
            queryLogExecutor.execute(() -> writeQueryLine(line));
        } catch (RejectedExecutionException e) {
            log.warn("⚠️ Query log backlog full, dropping trace for '{}'", TextUtils.truncate(trace.query(), 80));
        }
    }

    Path queryLogFile() {
        return directory.resolve(QUERY_LOG_FILE);
    }

    private synchronized void writeQueryLine(String line) {
        byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
        Path file = queryLogFile();
        try {
            Files.createDirectories(directory);
            if (queryLogMaxBytes > 0 && Files.exists(file) && Files.size(file) + bytes.length > queryLogMaxBytes) {
                Files.move(file, directory.resolve(ROLLED_QUERY_LOG_FILE), StandardCopyOption.REPLACE_EXISTING);
                log.info("Rolled query log at {} bytes", queryLogMaxBytes);
            }
            Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("⚠️ Failed to append to query log in {}: {}", directory, e.getMessage());
        }
    }
}
