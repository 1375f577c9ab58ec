package io.layoffs.core;

/**
 * Notified once for every record a stage drops, in dataset order. Storage-backed callers use it
 * to delete the matching rows.
 */
@FunctionalInterface
public interface RemovalListener {
    RemovalListener NONE = (stage, record) -> {};

    void removed(String stage, Record<?> record);
}
