package io.layoffs.analytics;

import io.layoffs.model.LayoffRecord;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sums layoffs per calendar month. Records without a date are skipped, absent counts add zero, and the
 * result is ordered by month ascending.
 */
public class MonthlyAggregator {

    public List<MonthlyTotal> aggregate(Collection<LayoffRecord> records) {
        TreeMap<YearMonth, Long> buckets = new TreeMap<>();
        for (LayoffRecord r : records) {
            if (r.date() == null) continue;
            buckets.merge(YearMonth.from(r.date()), r.totalOrZero(), Long::sum);
        }
        List<MonthlyTotal> out = new ArrayList<>(buckets.size());
        for (Map.Entry<YearMonth, Long> e : buckets.entrySet()) {
            out.add(new MonthlyTotal(e.getKey(), e.getValue()));
        }
        return out;
    }
}
