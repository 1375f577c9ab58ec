package io.layoffs.runtime;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.layoffs.budget.Budget;
import io.layoffs.core.BatchSink;
import io.layoffs.core.Record;
import io.layoffs.core.Sink;
import io.layoffs.core.Source;
import io.layoffs.core.Transform;
import io.layoffs.error.DeadLetterSink;
import io.layoffs.metrics.Metrics;
import io.layoffs.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-source -> single-transform -> single-sink pipeline. Transforms run on a worker pool; a single
 * sink thread re-establishes seq order before anything reaches the sink, so the output order does not
 * depend on the number of workers. Sources must number their records from 0 without gaps.
 */
public class Pipeline<I, O> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final Budget budget;
    private final RetryPolicy retryPolicy;
    private final int maxInFlight;
    private final int sinkBatchSize;
    private final int sinkFlushEveryMillis;
    private final DeadLetterSink<I> dlqIn;
    private final DeadLetterSink<O> dlqOut;

    private final ExecutorService workerPool;
    private final ArrayBlockingQueue<Batch<O>> queue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inflight = new AtomicInteger(0);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Thread srcThread;
    private volatile Thread sinkThread;
    private volatile long delivered;

    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;
    private final Histogram sinkBatchSizes;

    Pipeline(Source<I> source,
             Transform<I, O> transform,
             Sink<O> sink,
             Budget budget,
             RetryPolicy retryPolicy,
             int workers,
             int queueCapacity,
             Metrics metrics,
             DeadLetterSink<I> dlqIn,
             DeadLetterSink<O> dlqOut,
             int sinkBatchSize,
             int sinkFlushEveryMillis,
             int maxInFlight) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.budget = Objects.requireNonNull(budget);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.workerPool = Executors.newFixedThreadPool(Math.max(1, workers));
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.dlqIn = dlqIn;
        this.dlqOut = dlqOut;
        this.sinkBatchSize = Math.max(1, sinkBatchSize);
        this.sinkFlushEveryMillis = Math.max(0, sinkFlushEveryMillis);
        this.maxInFlight = Math.max(1, maxInFlight);
        this.sourceTimer = metrics.timer("pipeline.source.time");
        this.transformTimer = metrics.timer("pipeline.transform.time");
        this.sinkTimer = metrics.timer("pipeline.sink.time");
        this.inMeter = metrics.meter("pipeline.input.rate");
        this.outMeter = metrics.meter("pipeline.output.rate");
        this.errorMeter = metrics.meter("pipeline.error.rate");
        this.sinkBatchSizes = metrics.registry().histogram("pipeline.sink.batch.size");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        srcThread = new Thread(this::runSource, "pipeline-source");
        srcThread.start();
        // single sink thread to enforce ordering
        sinkThread = new Thread(this::runSink, "pipeline-sink");
        sinkThread.start();
    }

    /**
     * Blocks until the sink has received everything the source produced.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    public void stop() {
        running.set(false);
        Thread st = srcThread;
        Thread kt = sinkThread;
        if (st != null) { try { st.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); } }
        if (kt != null) { try { kt.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); } }
        workerPool.shutdown();
    }

    public boolean isFinished() { return done.getCount() == 0; }

    /** Inputs the sink has passed in seq order, counting those that produced no output or failed. */
    public long delivered() { return delivered; }

    private void runSource() {
        while (running.get()) {
            // Backpressure: limit pending/in-flight tasks
            if (inflight.get() >= maxInFlight) { sleepQuiet(1); continue; }
            Optional<Record<I>> opt;
            try (Timer.Context ignored = sourceTimer.time()) {
                opt = source.poll();
            }
            if (opt.isEmpty()) {
                if (source.isFinished()) break;
                sleepQuiet(1);
                continue;
            }
            inMeter.mark();
            Record<I> in = opt.get();
            inflight.incrementAndGet();
            workerPool.submit(() -> process(in));
        }
        // wait for all submitted work to complete, then signal end
        while (inflight.get() > 0) { sleepQuiet(2); }
        try {
            queue.put(Batch.poison());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private void process(Record<I> in) {
        while (!budget.tryAcquireCpu()) sleepQuiet(1);
        try {
            int attempt = 0;
            while (true) {
                attempt++;
                try (Timer.Context ignored = transformTimer.time()) {
                    List<Record<O>> outputs = transform.apply(in);
                    outputs = outputs == null ? new ArrayList<>() : new ArrayList<>(outputs);
                    outputs.sort(Comparator.comparingInt(Record::subSeq));
                    queue.put(Batch.of(in.seq(), outputs));
                    return;
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    errorMeter.mark();
                    log.warn("transform interrupted on seq={}, its output is lost", in.seq());
                    if (dlqIn != null) dlqIn.acceptFailure("transform", in, ie);
                    return;
                } catch (Exception e) {
                    errorMeter.mark();
                    if (retryPolicy.shouldRetry(attempt, e)) {
                        log.debug("transform failed for seq={} attempt={}, retrying", in.seq(), attempt, e);
                        sleepQuiet(retryPolicy.backoffMillis(attempt));
                        continue;
                    }
                    log.warn("transform gave up on seq={} after {} attempt(s): {}", in.seq(), attempt, e.toString());
                    if (dlqIn != null) dlqIn.acceptFailure("transform", in, e);
                    // an empty batch keeps the sink's seq order moving past the failed record
                    putQuiet(Batch.of(in.seq(), List.of()));
                    return;
                }
            }
        } finally {
            budget.releaseCpu();
            inflight.decrementAndGet();
        }
    }

    private void runSink() {
        try {
            List<Record<O>> emitBuffer = new ArrayList<>();
            long expectedSeq = 0;
            TreeMap<Long, Batch<O>> pending = new TreeMap<>();
            while (true) {
                Batch<O> batch = sinkFlushEveryMillis > 0
                        ? queue.poll(sinkFlushEveryMillis, TimeUnit.MILLISECONDS)
                        : queue.take();
                if (batch == null) {
                    flush(emitBuffer);
                    continue;
                }
                if (batch.isPoison()) {
                    if (!pending.isEmpty()) {
                        log.warn("sink finished with {} batch(es) still waiting for seq={}", pending.size(), expectedSeq);
                    }
                    flush(emitBuffer);
                    return;
                }
                pending.put(batch.seq, batch);
                Batch<O> ready;
                while ((ready = pending.remove(expectedSeq)) != null) {
                    for (Record<O> next : ready.items) {
                        emitBuffer.add(next);
                        if (emitBuffer.size() >= sinkBatchSize) flush(emitBuffer);
                    }
                    expectedSeq++;
                    delivered = expectedSeq;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            done.countDown();
        }
    }

    private void flush(List<Record<O>> records) {
        if (records.isEmpty()) return;
        try (Timer.Context ignored = sinkTimer.time()) {
            if (sink instanceof BatchSink<O> bs) {
                bs.acceptBatch(records);
            } else {
                for (Record<O> r : records) sink.accept(r);
            }
            outMeter.mark(records.size());
            sinkBatchSizes.update(records.size());
        } catch (Exception e) {
            errorMeter.mark();
            log.warn("sink rejected a batch of {} record(s): {}", records.size(), e.toString());
            if (dlqOut != null) {
                for (Record<O> r : records) dlqOut.acceptFailure("sink", r, e);
            }
        } finally {
            records.clear();
        }
    }

    private void putQuiet(Batch<O> batch) {
        try {
            queue.put(batch);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    @Override
    public void close() {
        stop();
        workerPool.shutdownNow();
    }

    static final class Batch<T> {
        final long seq;
        final List<Record<T>> items;
        private final boolean poison;

        private Batch(long seq, List<Record<T>> items, boolean poison) {
            this.seq = seq; this.items = items; this.poison = poison;
        }
        static <T> Batch<T> of(long seq, List<Record<T>> items) { return new Batch<>(seq, items, false); }
        static <T> Batch<T> poison() { return new Batch<>(Long.MAX_VALUE, List.of(), true); }
        boolean isPoison() { return poison; }
    }
}
