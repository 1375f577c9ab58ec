package io.layoffs.analytics;

import io.layoffs.model.LayoffRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

public class OverviewCalculator {
    private static final Comparator<DatasetOverview.FullShutdown> MOST_FUNDED_FIRST = Comparator
            .comparing(DatasetOverview.FullShutdown::fundsRaised, Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()))
            .thenComparing(DatasetOverview.FullShutdown::company, Comparator.nullsLast(Comparator.naturalOrder()));

    public DatasetOverview overview(Collection<LayoffRecord> records) {
        Integer maxTotal = null;
        Double maxPct = null;
        LocalDate first = null;
        LocalDate last = null;
        List<DatasetOverview.FullShutdown> shutdowns = new ArrayList<>();
        for (LayoffRecord r : records) {
            if (r.totalLaidOff() != null && (maxTotal == null || r.totalLaidOff() > maxTotal)) maxTotal = r.totalLaidOff();
            if (r.percentageLaidOff() != null && (maxPct == null || r.percentageLaidOff() > maxPct)) maxPct = r.percentageLaidOff();
            if (r.date() != null) {
                if (first == null || r.date().isBefore(first)) first = r.date();
                if (last == null || r.date().isAfter(last)) last = r.date();
            }
            if (r.percentageLaidOff() != null && r.percentageLaidOff() >= 1.0) {
                shutdowns.add(new DatasetOverview.FullShutdown(r.company(), r.totalLaidOff(), r.fundsRaised(), r.date()));
            }
        }
        shutdowns.sort(MOST_FUNDED_FIRST);
        return new DatasetOverview(records.size(), maxTotal, maxPct, first, last, shutdowns);
    }
}
