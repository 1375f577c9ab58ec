package io.layoffs.core;

import java.util.List;

/**
 * A batch stage that consumes a complete dataset and produces a complete new one.
 * The input list is never modified; implementations return a fresh list so that the previous
 * dataset stays valid until the stage has finished.
 */
public interface DatasetStage<I, O> {
    /** Short name used for metrics and log lines, e.g. {@code dedup}. */
    String name();

    List<Record<O>> apply(List<Record<I>> dataset);
}
