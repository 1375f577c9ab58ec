package io.layoffs.cleaning;

import io.layoffs.core.DatasetStage;
import io.layoffs.core.Record;
import io.layoffs.model.LayoffRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies a known industry into records of the same company that lack one. The lookup is built once
 * from the incoming dataset (the lowest-seq record with an industry wins per company), so filled values
 * are never used as a source themselves. Records without a company are left alone.
 */
public class NullFiller implements DatasetStage<LayoffRecord, LayoffRecord> {
    public static final String NAME = "fill";

    @Override
    public String name() { return NAME; }

    @Override
    public List<Record<LayoffRecord>> apply(List<Record<LayoffRecord>> dataset) {
        Map<String, String> industryByCompany = index(dataset);
        List<Record<LayoffRecord>> out = new ArrayList<>(dataset.size());
        for (Record<LayoffRecord> r : dataset) {
            LayoffRecord rec = r.payload();
            String known = rec.industry() == null && rec.company() != null ? industryByCompany.get(rec.company()) : null;
            out.add(known == null ? r : r.withPayload(rec.withIndustry(known)));
        }
        return out;
    }

    static Map<String, String> index(List<Record<LayoffRecord>> dataset) {
        Map<String, Record<LayoffRecord>> source = new HashMap<>();
        for (Record<LayoffRecord> r : dataset) {
            LayoffRecord rec = r.payload();
            if (rec.company() == null || rec.industry() == null) continue;
            source.merge(rec.company(), r, (a, b) -> a.seq() <= b.seq() ? a : b);
        }
        Map<String, String> out = new HashMap<>(source.size() * 2);
        source.forEach((company, r) -> out.put(company, r.payload().industry()));
        return out;
    }
}
