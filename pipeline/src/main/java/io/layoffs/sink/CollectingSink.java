package io.layoffs.sink;

import io.layoffs.core.BatchSink;
import io.layoffs.core.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory sink. The pipeline delivers in seq order, so the collected list is in dataset order.
 */
public class CollectingSink<T> implements BatchSink<T> {
    private final List<Record<T>> records = new ArrayList<>();

    @Override
    public synchronized void accept(Record<T> record) {
        records.add(record);
    }

    @Override
    public synchronized void acceptBatch(List<Record<T>> batch) {
        records.addAll(batch);
    }

    public synchronized List<Record<T>> records() {
        return List.copyOf(records);
    }
}
