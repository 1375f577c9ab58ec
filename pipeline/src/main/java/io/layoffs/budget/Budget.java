package io.layoffs.budget;

/**
 * Budget governs how many worker threads may run transforms at the same time.
 */
public interface Budget extends AutoCloseable {
    /** Acquire a CPU thread slot without blocking. Return true if acquired. */
    boolean tryAcquireCpu();

    void releaseCpu();

    /** Slots still available. */
    int availableCpu();

    @Override
    default void close() {}
}
