package io.layoffs.cleaning;

import io.layoffs.core.DatasetStage;
import io.layoffs.core.Record;
import io.layoffs.core.RemovalListener;
import io.layoffs.model.LayoffRecord;
import io.layoffs.model.RawLayoff;
import io.layoffs.runtime.StageRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToLongFunction;

/**
 * Dedup, normalize, fill, prune, then dedup once more on the cleaned values. Each stage sees the complete output of the one before it; removed
 * records are reported to the {@link RemovalListener} only after the stage that removed them completed.
 */
public class CleaningPipeline {
    private static final Logger log = LoggerFactory.getLogger(CleaningPipeline.class);

    private final Deduplicator<RawLayoff> deduplicator;
    private final DatasetStage<RawLayoff, LayoffRecord> normalizer;
    private final NullFiller filler;
    private final RowPruner pruner;
    private final Deduplicator<LayoffRecord> cleanedDeduplicator;
    private final StageRunner runner;
    private final RemovalListener removals;

    public CleaningPipeline(Deduplicator<RawLayoff> deduplicator,
                            DatasetStage<RawLayoff, LayoffRecord> normalizer,
                            NullFiller filler,
                            RowPruner pruner,
                            Deduplicator<LayoffRecord> cleanedDeduplicator,
                            StageRunner runner,
                            RemovalListener removals) {
        this.deduplicator = Objects.requireNonNull(deduplicator);
        this.normalizer = Objects.requireNonNull(normalizer);
        this.filler = Objects.requireNonNull(filler);
        this.pruner = Objects.requireNonNull(pruner);
        this.cleanedDeduplicator = Objects.requireNonNull(cleanedDeduplicator);
        this.runner = Objects.requireNonNull(runner);
        this.removals = removals == null ? RemovalListener.NONE : removals;
    }

    /**
     * @throws io.layoffs.error.StageFailedException if a stage cannot complete; no later stage runs
     */
    public CleaningResult clean(List<Record<RawLayoff>> raw) {
        Objects.requireNonNull(raw, "raw dataset");

        List<Record<RawLayoff>> unique = runner.run(deduplicator, raw);
        List<Long> duplicateIds = new ArrayList<>(removed(deduplicator.name(), raw, unique, r -> r.payload().id()));

        List<Record<LayoffRecord>> normalized = runner.run(normalizer, unique);
        int unparsedDates = unparsedDates(unique, normalized);

        List<Record<LayoffRecord>> filled = runner.run(filler, normalized);
        int industriesFilled = 0;
        for (int i = 0; i < filled.size(); i++) {
            if (normalized.get(i).payload().industry() == null && filled.get(i).payload().industry() != null) {
                industriesFilled++;
            }
        }

        List<Record<LayoffRecord>> pruned = runner.run(pruner, filled);
        List<Long> prunedIds = removed(pruner.name(), filled, pruned, r -> r.payload().id());

        List<Record<LayoffRecord>> cleaned = runner.run(cleanedDeduplicator, pruned);
        duplicateIds.addAll(removed(cleanedDeduplicator.name(), pruned, cleaned, r -> r.payload().id()));

        runner.metrics().counter("cleaning.dedup.removed").inc(duplicateIds.size());
        runner.metrics().counter("cleaning.fill.filled").inc(industriesFilled);
        runner.metrics().counter("cleaning.prune.removed").inc(prunedIds.size());
        runner.metrics().counter("cleaning.normalize.unparsedDates").inc(unparsedDates);
        log.info("cleaned {} raw row(s) into {}: duplicates={} pruned={} filled={} unparsedDates={}",
                raw.size(), cleaned.size(), duplicateIds.size(), prunedIds.size(), industriesFilled, unparsedDates);
        return new CleaningResult(cleaned, raw.size(), duplicateIds, prunedIds, industriesFilled, unparsedDates);
    }

    private <T> List<Long> removed(String stage, List<Record<T>> before, List<Record<T>> after,
                                   ToLongFunction<Record<T>> idOf) {
        Set<Long> kept = new HashSet<>(after.size() * 2);
        for (Record<T> r : after) kept.add(r.seq());
        List<Long> ids = new ArrayList<>();
        for (Record<T> r : before) {
            if (kept.contains(r.seq())) continue;
            ids.add(idOf.applyAsLong(r));
            removals.removed(stage, r);
        }
        return ids;
    }

    private static int unparsedDates(List<Record<RawLayoff>> raw, List<Record<LayoffRecord>> normalized) {
        int n = 0;
        for (int i = 0; i < Math.min(raw.size(), normalized.size()); i++) {
            String text = raw.get(i).payload().date();
            if (text != null && !text.isBlank() && normalized.get(i).payload().date() == null) n++;
        }
        return n;
    }
}
