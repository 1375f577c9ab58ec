package io.layoffs.error;

import io.layoffs.core.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps failures in memory so the caller can decide whether the whole stage failed.
 */
public class CollectingDeadLetterSink<T> implements DeadLetterSink<T> {
    private final List<Failure<T>> failures = new ArrayList<>();

    public record Failure<T>(String stage, Record<T> record, Exception error) {}

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, Exception e) {
        failures.add(new Failure<>(stage, record, e));
    }

    public synchronized List<Failure<T>> failures() {
        return List.copyOf(failures);
    }

    public synchronized boolean isEmpty() {
        return failures.isEmpty();
    }
}
