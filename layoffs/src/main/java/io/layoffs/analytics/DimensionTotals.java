package io.layoffs.analytics;

import io.layoffs.model.LayoffRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Total layoffs per value of a {@link Dimension}, largest first; equal totals are ordered by key with
 * the absent key last.
 */
public class DimensionTotals {
    private static final Comparator<DimensionTotal> ORDER = Comparator
            .<DimensionTotal>comparingLong(DimensionTotal::total).reversed()
            .thenComparing(DimensionTotal::key, Comparator.nullsLast(Comparator.naturalOrder()));

    public List<DimensionTotal> totals(Collection<LayoffRecord> records, Dimension dimension) {
        Map<String, Long> sums = new LinkedHashMap<>();
        for (LayoffRecord r : records) {
            sums.merge(dimension.valueOf(r), r.totalOrZero(), Long::sum);
        }
        List<DimensionTotal> out = new ArrayList<>(sums.size());
        sums.forEach((key, total) -> out.add(new DimensionTotal(key, total)));
        out.sort(ORDER);
        return out;
    }
}
