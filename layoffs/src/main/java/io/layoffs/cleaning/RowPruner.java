package io.layoffs.cleaning;

import io.layoffs.core.DatasetStage;
import io.layoffs.core.Record;
import io.layoffs.model.LayoffRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops records that carry neither a head count nor a percentage. A count of zero is kept.
 */
public class RowPruner implements DatasetStage<LayoffRecord, LayoffRecord> {
    public static final String NAME = "prune";

    @Override
    public String name() { return NAME; }

    @Override
    public List<Record<LayoffRecord>> apply(List<Record<LayoffRecord>> dataset) {
        List<Record<LayoffRecord>> out = new ArrayList<>(dataset.size());
        for (Record<LayoffRecord> r : dataset) {
            if (r.payload().hasMagnitude()) out.add(r);
        }
        return out;
    }
}
