package io.layoffs.runtime;

import com.codahale.metrics.Timer;
import io.layoffs.core.DatasetStage;
import io.layoffs.core.Record;
import io.layoffs.error.StageFailedException;
import io.layoffs.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs dataset stages one after another. A stage either returns its complete output, which is then
 * frozen, or fails with {@link StageFailedException} and the caller keeps its previous dataset.
 */
public class StageRunner {
    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final Metrics metrics;

    public StageRunner(Metrics metrics) {
        this.metrics = Objects.requireNonNull(metrics);
    }

    public Metrics metrics() { return metrics; }

    public <I, O> List<Record<O>> run(DatasetStage<I, O> stage, List<Record<I>> dataset) {
        Objects.requireNonNull(dataset, "dataset");
        String name = stage.name();
        List<Record<I>> input = List.copyOf(dataset);
        metrics.stageIn(name).inc(input.size());
        long t0 = System.nanoTime();
        List<Record<O>> output;
        try (Timer.Context ignored = metrics.stageTimer(name).time()) {
            output = stage.apply(input);
        } catch (StageFailedException e) {
            log.error("stage {} failed on {} record(s)", name, input.size(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("stage {} failed on {} record(s)", name, input.size(), e);
            throw new StageFailedException(name, e);
        }
        if (output == null) throw new StageFailedException(name, "returned no dataset");
        List<Record<O>> frozen = List.copyOf(output);
        metrics.stageOut(name).inc(frozen.size());
        log.info("stage {} in={} out={} took={}ms", name, input.size(), frozen.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
        return frozen;
    }
}
