package io.layoffs.core;

/**
 * A dataset element: the payload plus its ingestion position.
 * seq is the position assigned by the source and is kept by every stage, so it doubles as the
 * "first wins" order for tie-breaks; subSeq orders fan-out within one input.
 */
public record Record<T>(long seq, int subSeq, T payload) {
    public static <T> Record<T> of(long seq, T payload) {
        return new Record<>(seq, 0, payload);
    }

    /** Same position, new payload. */
    public <R> Record<R> withPayload(R newPayload) {
        return new Record<>(seq, subSeq, newPayload);
    }
}
