package io.layoffs.analytics;

/**
 * @param key   the dimension value, null for records where it is absent
 * @param total summed head count, absent counts as zero
 */
public record DimensionTotal(String key, long total) {}
