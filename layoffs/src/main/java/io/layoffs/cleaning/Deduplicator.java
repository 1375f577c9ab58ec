package io.layoffs.cleaning;

import io.layoffs.core.DatasetStage;
import io.layoffs.core.Record;
import io.layoffs.model.LayoffRecord;
import io.layoffs.model.RawLayoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Drops every record whose {@link DuplicateKey} was already seen at a lower seq. Survivors keep their
 * relative order, and running the stage on its own output removes nothing.
 */
public class Deduplicator<T> implements DatasetStage<T, T> {
    public static final String NAME = "dedup";
    /** Second pass over normalized and filled records; rows that only differed in spelling collapse here. */
    public static final String CLEANED_NAME = "dedupCleaned";
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final String name;
    private final Function<T, DuplicateKey> keyOf;
    private final AbsentKeyMatching absentKeys;

    public Deduplicator(String name, Function<T, DuplicateKey> keyOf, AbsentKeyMatching absentKeys) {
        this.name = Objects.requireNonNull(name);
        this.keyOf = Objects.requireNonNull(keyOf);
        this.absentKeys = Objects.requireNonNull(absentKeys);
    }

    public static Deduplicator<RawLayoff> forRaw(AbsentKeyMatching absentKeys) {
        return new Deduplicator<>(NAME, DuplicateKey::of, absentKeys);
    }

    public static Deduplicator<LayoffRecord> forCleaned(AbsentKeyMatching absentKeys) {
        return new Deduplicator<>(CLEANED_NAME, DuplicateKey::of, absentKeys);
    }

    @Override
    public String name() { return name; }

    public AbsentKeyMatching absentKeys() { return absentKeys; }

    @Override
    public List<Record<T>> apply(List<Record<T>> dataset) {
        // pass 1: lowest seq per key, independent of the order records arrive in
        Map<DuplicateKey, Long> firstSeq = new HashMap<>();
        for (Record<T> r : dataset) {
            DuplicateKey key = keyOf.apply(r.payload());
            if (isAlwaysDistinct(key)) continue;
            firstSeq.merge(key, r.seq(), Math::min);
        }
        // pass 2: keep the survivor of each group
        List<Record<T>> out = new ArrayList<>(dataset.size());
        for (Record<T> r : dataset) {
            DuplicateKey key = keyOf.apply(r.payload());
            if (isAlwaysDistinct(key) || firstSeq.get(key) == r.seq()) {
                out.add(r);
            }
        }
        if (out.size() < dataset.size()) {
            log.debug("{} removed {} of {} record(s) using absentKeys={}", name, dataset.size() - out.size(), dataset.size(), absentKeys);
        }
        return out;
    }

    private boolean isAlwaysDistinct(DuplicateKey key) {
        return absentKeys == AbsentKeyMatching.DISTINCT && key.hasAbsent();
    }
}
