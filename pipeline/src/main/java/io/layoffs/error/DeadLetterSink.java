package io.layoffs.error;

import io.layoffs.core.Record;

public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, Record<T> record, Exception e);

    @Override
    default void close() {}
}
