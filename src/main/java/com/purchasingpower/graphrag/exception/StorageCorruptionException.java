package com.purchasingpower.graphrag.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Persisted snapshot failed its integrity check or could not be parsed.
 * The store stays unavailable until a rebuild or import commits a fresh snapshot.
 *
 * @since 1.0.0
 */
@Getter
public class StorageCorruptionException extends GraphRagException {

    private final Path location;

    public StorageCorruptionException(Path location, String message) {
        super(message + " (" + location + ")");
        this.location = location;
    }

    public StorageCorruptionException(Path location, String message, Throwable cause) {
        super(message + " (" + location + ")", cause);
        this.location = location;
    }
}
