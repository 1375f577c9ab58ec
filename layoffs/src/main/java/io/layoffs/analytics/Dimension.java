package io.layoffs.analytics;

import io.layoffs.model.LayoffRecord;

import java.util.function.Function;

/**
 * A column layoffs can be summed by.
 */
public enum Dimension {
    COMPANY(LayoffRecord::company),
    INDUSTRY(LayoffRecord::industry),
    COUNTRY(LayoffRecord::country),
    STAGE(LayoffRecord::stage),
    YEAR(r -> r.date() == null ? null : String.valueOf(r.date().getYear()));

    private final Function<LayoffRecord, String> extractor;

    Dimension(Function<LayoffRecord, String> extractor) {
        this.extractor = extractor;
    }

    public String valueOf(LayoffRecord r) {
        return extractor.apply(r);
    }
}
