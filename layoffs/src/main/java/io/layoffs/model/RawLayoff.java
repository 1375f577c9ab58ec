package io.layoffs.model;

import java.math.BigDecimal;

/**
 * A layoff event as the loader delivers it. Text is untrimmed and the date is still the source text.
 * Any field may be null.
 */
public record RawLayoff(
        long id,
        String company,
        String location,
        String industry,
        Integer totalLaidOff,
        Double percentageLaidOff,
        String date,
        String stage,
        String country,
        BigDecimal fundsRaised
) {
    public static Builder builder(long id) { return new Builder(id); }

    public static final class Builder {
        private final long id;
        private String company;
        private String location;
        private String industry;
        private Integer totalLaidOff;
        private Double percentageLaidOff;
        private String date;
        private String stage;
        private String country;
        private BigDecimal fundsRaised;

        private Builder(long id) { this.id = id; }

        public Builder company(String v) { this.company = v; return this; }
        public Builder location(String v) { this.location = v; return this; }
        public Builder industry(String v) { this.industry = v; return this; }
        public Builder totalLaidOff(Integer v) { this.totalLaidOff = v; return this; }
        public Builder percentageLaidOff(Double v) { this.percentageLaidOff = v; return this; }
        public Builder date(String v) { this.date = v; return this; }
        public Builder stage(String v) { this.stage = v; return this; }
        public Builder country(String v) { this.country = v; return this; }
        public Builder fundsRaised(BigDecimal v) { this.fundsRaised = v; return this; }

        public RawLayoff build() {
            return new RawLayoff(id, company, location, industry, totalLaidOff, percentageLaidOff,
                    date, stage, country, fundsRaised);
        }
    }
}
