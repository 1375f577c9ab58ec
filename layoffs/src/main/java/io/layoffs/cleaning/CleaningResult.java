package io.layoffs.cleaning;

import io.layoffs.core.Record;
import io.layoffs.model.LayoffRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one cleaning run.
 *
 * @param records          surviving records in ingestion order
 * @param inputCount       rows handed to the run
 * @param duplicateIds     ids removed as duplicates: raw duplicates first, then those found on cleaned values
 * @param prunedIds        ids removed for lacking any layoff magnitude
 * @param industriesFilled records whose industry was copied from another record
 * @param unparsedDates    records whose date text could not be parsed and became absent
 */
public record CleaningResult(
        List<Record<LayoffRecord>> records,
        int inputCount,
        List<Long> duplicateIds,
        List<Long> prunedIds,
        int industriesFilled,
        int unparsedDates
) {
    public CleaningResult {
        records = List.copyOf(records);
        duplicateIds = List.copyOf(duplicateIds);
        prunedIds = List.copyOf(prunedIds);
    }

    public List<LayoffRecord> cleaned() {
        List<LayoffRecord> out = new ArrayList<>(records.size());
        for (Record<LayoffRecord> r : records) out.add(r.payload());
        return out;
    }
}
