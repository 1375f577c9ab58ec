package io.layoffs.cleaning;

import io.layoffs.model.LayoffRecord;
import io.layoffs.model.RawLayoff;

/**
 * The business key two events must share to count as the same report. {@code date} is the raw text
 * before normalization and a {@link java.time.LocalDate} after it.
 */
public record DuplicateKey(
        String company,
        String location,
        String industry,
        Integer totalLaidOff,
        Double percentageLaidOff,
        Object date
) {
    public static DuplicateKey of(RawLayoff r) {
        return new DuplicateKey(r.company(), r.location(), r.industry(), r.totalLaidOff(), r.percentageLaidOff(), r.date());
    }

    public static DuplicateKey of(LayoffRecord r) {
        return new DuplicateKey(r.company(), r.location(), r.industry(), r.totalLaidOff(), r.percentageLaidOff(), r.date());
    }

    public boolean hasAbsent() {
        return company == null || location == null || industry == null
                || totalLaidOff == null || percentageLaidOff == null || date == null;
    }
}
