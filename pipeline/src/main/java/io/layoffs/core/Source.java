package io.layoffs.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A Source produces records in seq order.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch next available record if any. Return empty when temporarily no data and rely on
     * {@link #isFinished()} to indicate completion for finite sources.
     */
    Optional<Record<T>> poll();

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() {}
}
