package io.layoffs.cleaning;

import io.layoffs.core.Record;
import io.layoffs.core.Transform;
import io.layoffs.model.LayoffRecord;
import io.layoffs.model.RawLayoff;

import java.util.List;
import java.util.Objects;

/**
 * Turns a raw row into a typed {@link LayoffRecord}: text is trimmed and blank text becomes absent,
 * industry goes through the {@link IndustryCanonicalizer}, trailing periods are dropped from the
 * country and the date is parsed. Never fails and always emits exactly one record.
 */
public class Normalizer implements Transform<RawLayoff, LayoffRecord> {
    public static final String NAME = "normalize";

    private final IndustryCanonicalizer industries;
    private final LayoffDateParser dates;

    public Normalizer(IndustryCanonicalizer industries, LayoffDateParser dates) {
        this.industries = Objects.requireNonNull(industries);
        this.dates = Objects.requireNonNull(dates);
    }

    @Override
    public List<Record<LayoffRecord>> apply(Record<RawLayoff> input) {
        return List.of(input.withPayload(normalize(input.payload())));
    }

    public LayoffRecord normalize(RawLayoff raw) {
        return new LayoffRecord(
                raw.id(),
                text(raw.company()),
                text(raw.location()),
                industries.canonicalize(text(raw.industry())),
                raw.totalLaidOff(),
                raw.percentageLaidOff(),
                dates.parse(raw.date()),
                text(raw.stage()),
                country(raw.country()),
                raw.fundsRaised());
    }

    static String text(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    // "United States." -> "United States"
    static String country(String s) {
        String t = text(s);
        if (t == null) return null;
        int end = t.length();
        while (end > 0 && t.charAt(end - 1) == '.') end--;
        return text(t.substring(0, end));
    }
}
