package io.layoffs.model;

import io.layoffs.core.Record;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class LayoffFixtures {
    private LayoffFixtures() {}

    public static LayoffRecord event(long id, String company, String industry, Integer total, Double pct, LocalDate date) {
        return LayoffRecord.builder(id)
                .company(company)
                .location("SF Bay Area")
                .industry(industry)
                .totalLaidOff(total)
                .percentageLaidOff(pct)
                .date(date)
                .country("United States")
                .build();
    }

    public static LayoffRecord dated(String company, Integer total, LocalDate date) {
        return event(0, company, "Tech", total, null, date);
    }

    /** Wraps payloads as records numbered from 0 in list order. */
    @SafeVarargs
    public static <T> List<Record<T>> dataset(T... payloads) {
        List<Record<T>> out = new ArrayList<>(payloads.length);
        for (int i = 0; i < payloads.length; i++) out.add(Record.of(i, payloads[i]));
        return out;
    }

    public static <T> List<T> payloads(List<Record<T>> records) {
        List<T> out = new ArrayList<>(records.size());
        for (Record<T> r : records) out.add(r.payload());
        return out;
    }
}
