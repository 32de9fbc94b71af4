package com.purchasingpower.graphrag.storage;

/**
 * Staging area of a build. Starts empty; nothing is visible to readers until
 * {@link #commit()} swaps the staged graph live in one step.
 *
 * <p>Closing an uncommitted transaction aborts it and releases the write lock.
 *
 * @since 1.0.0
 */
public interface GraphTransaction extends GraphWriter, AutoCloseable {

    int entityCount();

    /**
     * Publishes the staged graph and returns the new live snapshot.
     */
    GraphSnapshot commit();

    void abort();

    boolean isOpen();

    @Override
    default void close() {
        if (isOpen()) {
            abort();
        }
    }
}
