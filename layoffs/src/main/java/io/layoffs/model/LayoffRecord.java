package io.layoffs.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A normalized layoff event. Text fields are trimmed and never blank, the date is typed.
 * Null means the value is absent.
 *
 * @param id                 surrogate identity assigned at ingestion, only used to target deletions
 * @param totalLaidOff       head count, non-negative
 * @param percentageLaidOff  fraction of the workforce in [0, 1]
 * @param fundsRaised        millions raised before the event
 */
public record LayoffRecord(
        long id,
        String company,
        String location,
        String industry,
        Integer totalLaidOff,
        Double percentageLaidOff,
        LocalDate date,
        String stage,
        String country,
        BigDecimal fundsRaised
) {
    public LayoffRecord withIndustry(String newIndustry) {
        return new LayoffRecord(id, company, location, newIndustry, totalLaidOff, percentageLaidOff,
                date, stage, country, fundsRaised);
    }

    public boolean hasMagnitude() {
        return totalLaidOff != null || percentageLaidOff != null;
    }

    /** Absent counts contribute nothing to sums. */
    public long totalOrZero() {
        return totalLaidOff == null ? 0L : totalLaidOff;
    }

    public static Builder builder(long id) { return new Builder(id); }

    public static final class Builder {
        private final long id;
        private String company;
        private String location;
        private String industry;
        private Integer totalLaidOff;
        private Double percentageLaidOff;
        private LocalDate date;
        private String stage;
        private String country;
        private BigDecimal fundsRaised;

        private Builder(long id) { this.id = id; }

        public Builder company(String v) { this.company = v; return this; }
        public Builder location(String v) { this.location = v; return this; }
        public Builder industry(String v) { this.industry = v; return this; }
        public Builder totalLaidOff(Integer v) { this.totalLaidOff = v; return this; }
        public Builder percentageLaidOff(Double v) { this.percentageLaidOff = v; return this; }
        public Builder date(LocalDate v) { this.date = v; return this; }
        public Builder stage(String v) { this.stage = v; return this; }
        public Builder country(String v) { this.country = v; return this; }
        public Builder fundsRaised(BigDecimal v) { this.fundsRaised = v; return this; }

        public LayoffRecord build() {
            return new LayoffRecord(id, company, location, industry, totalLaidOff, percentageLaidOff,
                    date, stage, country, fundsRaised);
        }
    }
}
