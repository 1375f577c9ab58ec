package io.layoffs.runtime;

import com.codahale.metrics.MetricRegistry;
import io.layoffs.core.DatasetStage;
import io.layoffs.core.Record;
import io.layoffs.core.Transform;
import io.layoffs.error.CollectingDeadLetterSink;
import io.layoffs.error.DeadLetterSink;
import io.layoffs.error.StageFailedException;
import io.layoffs.retry.RetryPolicy;
import io.layoffs.sink.CollectingSink;
import io.layoffs.source.ListSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Lifts a per-record {@link Transform} to a whole-dataset stage. With more than one worker the records go
 * through a {@link Pipeline}; the result is the same list the sequential path produces, with every output
 * carrying the seq of the input it came from. Any record that still fails after retries fails the stage;
 * failed records are handed to the optional dead-letter sink first.
 */
public class ParallelTransformStage<I, O> implements DatasetStage<I, O> {
    private final String name;
    private final Transform<I, O> transform;
    private final int workers;
    private final RetryPolicy retryPolicy;
    private final MetricRegistry registry;
    private final long timeoutMillis;
    private final DeadLetterSink<I> deadLetters;

    public ParallelTransformStage(String name, Transform<I, O> transform, int workers) {
        this(name, transform, workers, RetryPolicy.NEVER, new MetricRegistry(), TimeUnit.MINUTES.toMillis(10), null);
    }

    /**
     * @param deadLetters receives every record that failed for good, may be null
     */
    public ParallelTransformStage(String name, Transform<I, O> transform, int workers,
                                  RetryPolicy retryPolicy, MetricRegistry registry, long timeoutMillis,
                                  DeadLetterSink<I> deadLetters) {
        this.name = Objects.requireNonNull(name);
        this.transform = Objects.requireNonNull(transform);
        this.workers = Math.max(1, workers);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.registry = Objects.requireNonNull(registry);
        this.timeoutMillis = timeoutMillis;
        this.deadLetters = deadLetters;
    }

    @Override
    public String name() { return name; }

    public int workers() { return workers; }

    @Override
    public List<Record<O>> apply(List<Record<I>> dataset) {
        if (workers == 1 || dataset.size() < 2) return applySequential(dataset);
        return applyParallel(dataset);
    }

    private List<Record<O>> applySequential(List<Record<I>> dataset) {
        List<Record<O>> out = new ArrayList<>(dataset.size());
        for (Record<I> in : dataset) {
            List<Record<O>> produced = applyWithRetry(in);
            List<Record<O>> sorted = new ArrayList<>(produced);
            sorted.sort(Comparator.comparingInt(Record::subSeq));
            out.addAll(sorted);
        }
        return out;
    }

    private List<Record<O>> applyWithRetry(Record<I> in) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                List<Record<O>> produced = transform.apply(in);
                return produced == null ? List.of() : produced;
            } catch (Exception e) {
                if (!retryPolicy.shouldRetry(attempt, e)) {
                    if (deadLetters != null) deadLetters.acceptFailure(name, in, e);
                    throw new StageFailedException(name, e);
                }
                try {
                    Thread.sleep(retryPolicy.backoffMillis(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StageFailedException(name, ie);
                }
            }
        }
    }

    private List<Record<O>> applyParallel(List<Record<I>> dataset) {
        // Records are re-numbered by list position so the pipeline sees a gap-free seq range.
        Transform<Record<I>, O> positional = position -> {
            List<Record<O>> produced = transform.apply(position.payload());
            if (produced == null) return List.of();
            List<Record<O>> renumbered = new ArrayList<>(produced.size());
            for (Record<O> r : produced) renumbered.add(new Record<>(position.seq(), r.subSeq(), r.payload()));
            return renumbered;
        };
        CollectingSink<O> sink = new CollectingSink<>();
        CollectingDeadLetterSink<Record<I>> failedIn = new CollectingDeadLetterSink<>();
        CollectingDeadLetterSink<O> failedOut = new CollectingDeadLetterSink<>();

        Pipeline<Record<I>, O> pipeline = new PipelineBuilder<Record<I>, O>()
                .source(new ListSource<>(dataset))
                .transform(positional)
                .sink(sink)
                .retry(retryPolicy)
                .workers(workers)
                .backpressure(Math.max(16, workers * 4), Math.max(16, workers * 8))
                .sinkBatching(256, 0)
                .metrics(registry)
                .deadLetters(failedIn, failedOut)
                .build();
        try {
            pipeline.start();
            if (!pipeline.awaitCompletion(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new StageFailedException(name, "did not complete within " + timeoutMillis + " ms");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StageFailedException(name, ie);
        } finally {
            pipeline.close();
        }

        if (!failedIn.isEmpty()) {
            // workers finish out of order
            List<CollectingDeadLetterSink.Failure<Record<I>>> failures = new ArrayList<>(failedIn.failures());
            failures.sort(Comparator.comparingLong(f -> f.record().seq()));
            if (deadLetters != null) {
                for (var f : failures) deadLetters.acceptFailure(name, f.record().payload(), f.error());
            }
            var first = failures.get(0);
            throw new StageFailedException(name, failures.size() + " record(s) failed, first at seq="
                    + first.record().payload().seq() + ": " + first.error());
        }
        if (!failedOut.isEmpty()) {
            throw new StageFailedException(name, failedOut.failures().size() + " record(s) could not be collected");
        }
        if (pipeline.delivered() != dataset.size()) {
            throw new StageFailedException(name, "only " + pipeline.delivered() + " of " + dataset.size()
                    + " record(s) reached the sink");
        }

        List<Record<O>> collected = sink.records();
        List<Record<O>> out = new ArrayList<>(collected.size());
        for (Record<O> r : collected) {
            long originalSeq = dataset.get((int) r.seq()).seq();
            out.add(new Record<>(originalSeq, r.subSeq(), r.payload()));
        }
        return out;
    }
}
