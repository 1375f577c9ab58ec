package io.layoffs.runtime;

import com.codahale.metrics.MetricRegistry;
import io.layoffs.budget.SimpleBudgetManager;
import io.layoffs.core.Sink;
import io.layoffs.core.Source;
import io.layoffs.core.Transform;
import io.layoffs.error.DeadLetterSink;
import io.layoffs.metrics.Metrics;
import io.layoffs.retry.RetryPolicy;

import java.util.Objects;

/**
 * Assembles a {@link Pipeline}. Every worker gets its own CPU slot; queue and in-flight limits default to
 * a few batches per worker.
 */
public class PipelineBuilder<I, O> {
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private RetryPolicy retryPolicy = RetryPolicy.NEVER;
    private int workers = 4;
    private int queueCapacity = -1;
    private int maxInFlight = -1;
    private int sinkBatchSize = 16;
    private int sinkFlushEveryMillis = 100;
    private MetricRegistry metricRegistry;
    private DeadLetterSink<I> failedInputs;
    private DeadLetterSink<O> failedOutputs;

    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public PipelineBuilder<I, O> workers(int w) {
        this.workers = Math.max(1, w);
        return this;
    }

    /** Bounds the transformed batches waiting for the sink and the records submitted but not yet transformed. */
    public PipelineBuilder<I, O> backpressure(int queueCapacity, int maxInFlight) {
        this.queueCapacity = Math.max(1, queueCapacity);
        this.maxInFlight = Math.max(1, maxInFlight);
        return this;
    }

    /** {@code flushEveryMillis == 0} flushes only on a full batch or at the end of input. */
    public PipelineBuilder<I, O> sinkBatching(int batchSize, int flushEveryMillis) {
        this.sinkBatchSize = Math.max(1, batchSize);
        this.sinkFlushEveryMillis = Math.max(0, flushEveryMillis);
        return this;
    }

    /** Either side may be null, in which case those failures are only counted and logged. */
    public PipelineBuilder<I, O> deadLetters(DeadLetterSink<I> inputs, DeadLetterSink<O> outputs) {
        this.failedInputs = inputs;
        this.failedOutputs = outputs;
        return this;
    }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        int queue = queueCapacity > 0 ? queueCapacity : workers * 4;
        int inFlight = maxInFlight > 0 ? maxInFlight : workers * 8;
        Metrics metrics = new Metrics(metricRegistry != null ? metricRegistry : new MetricRegistry());
        return new Pipeline<>(source, transform, sink, new SimpleBudgetManager(workers), retryPolicy, workers, queue,
                metrics, failedInputs, failedOutputs, sinkBatchSize, sinkFlushEveryMillis, inFlight);
    }
}
