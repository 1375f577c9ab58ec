package io.layoffs.analytics;

import io.layoffs.model.LayoffRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ranks companies by total layoffs within each year and keeps the top band.
 *
 * <p>Ranking is dense: equal totals share a rank and the next distinct total gets the previous rank
 * plus one, so {@code 100, 100, 80, 50} ranks {@code 1, 1, 2, 3}. A band of 5 therefore keeps every
 * company whose rank is at most 5, which can be more than five rows. Within equal totals companies are
 * listed by name, absent names last. Records without a date take no part.
 */
public class PartitionRanker {
    public static final int DEFAULT_BAND = 5;

    private static final Comparator<CompanyYear> ORDER = Comparator
            .<CompanyYear>comparingLong(CompanyYear::total).reversed()
            .thenComparing(CompanyYear::company, Comparator.nullsLast(Comparator.naturalOrder()));

    private final int band;

    public PartitionRanker() {
        this(DEFAULT_BAND);
    }

    public PartitionRanker(int band) {
        if (band < 1) throw new IllegalArgumentException("band must be >= 1, was " + band);
        this.band = band;
    }

    public int band() { return band; }

    public List<YearRanking> rank(Collection<LayoffRecord> records) {
        // step 1: (company, year) -> total, partitioned by year
        TreeMap<Integer, Map<String, Long>> byYear = new TreeMap<>();
        for (LayoffRecord r : records) {
            if (r.date() == null) continue;
            byYear.computeIfAbsent(r.date().getYear(), y -> new LinkedHashMap<>())
                    .merge(r.company(), r.totalOrZero(), Long::sum);
        }

        List<YearRanking> out = new ArrayList<>(byYear.size());
        for (Map.Entry<Integer, Map<String, Long>> partition : byYear.entrySet()) {
            int year = partition.getKey();
            List<CompanyYear> rows = new ArrayList<>(partition.getValue().size());
            partition.getValue().forEach((company, total) -> rows.add(new CompanyYear(company, total)));
            // step 2: descending by total
            rows.sort(ORDER);

            // step 3 and 4: dense rank, stop once past the band
            List<RankedCompany> top = new ArrayList<>();
            int rank = 0;
            Long previous = null;
            for (CompanyYear row : rows) {
                if (previous == null || row.total() != previous) rank++;
                previous = row.total();
                if (rank > band) break;
                top.add(new RankedCompany(row.company(), year, row.total(), rank));
            }
            out.add(new YearRanking(year, top));
        }
        return out;
    }

    private record CompanyYear(String company, long total) {}
}
