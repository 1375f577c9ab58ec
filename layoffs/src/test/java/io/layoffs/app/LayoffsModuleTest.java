package io.layoffs.app;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.layoffs.analytics.LayoffAnalytics;
import io.layoffs.analytics.PartitionRanker;
import io.layoffs.cleaning.AbsentKeyMatching;
import io.layoffs.cleaning.CleaningPipeline;
import io.layoffs.cleaning.CleaningResult;
import io.layoffs.cleaning.Deduplicator;
import io.layoffs.cleaning.IndustryCanonicalizer;
import io.layoffs.cleaning.RowPruner;
import io.layoffs.config.LayoffsConfig;
import io.layoffs.error.CollectingDeadLetterSink;
import io.layoffs.error.DeadLetterSink;
import io.layoffs.error.FileDeadLetterSink;
import io.layoffs.model.LayoffRecord;
import io.layoffs.model.RawLayoff;
import io.layoffs.retry.ExponentialBackoffRetryPolicy;
import io.layoffs.retry.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static io.layoffs.model.LayoffFixtures.dataset;
import static org.junit.jupiter.api.Assertions.*;

class LayoffsModuleTest {
    private static final Key<DeadLetterSink<RawLayoff>> DEAD_LETTERS = Key.get(new TypeLiteral<DeadLetterSink<RawLayoff>>() {});

    @Test
    void wires_stages_from_the_config() {
        LayoffsConfig cfg = config(2, 3, AbsentKeyMatching.DISTINCT, 1, null);
        Injector injector = Guice.createInjector(new LayoffsModule(cfg));

        assertEquals(3, injector.getInstance(PartitionRanker.class).band());
        assertEquals("Finance", injector.getInstance(IndustryCanonicalizer.class).canonicalize("Fintech"));
        Deduplicator<RawLayoff> dedup = injector.getInstance(Key.get(new TypeLiteral<Deduplicator<RawLayoff>>() {}));
        assertEquals(AbsentKeyMatching.DISTINCT, dedup.absentKeys());
        assertSame(injector.getInstance(MetricRegistry.class), injector.getInstance(MetricRegistry.class));
        assertNotNull(injector.getInstance(LayoffAnalytics.class));
        Deduplicator<LayoffRecord> cleanedDedup = injector.getInstance(Key.get(new TypeLiteral<Deduplicator<LayoffRecord>>() {}));
        assertEquals(Deduplicator.CLEANED_NAME, cleanedDedup.name());
        assertEquals(AbsentKeyMatching.DISTINCT, cleanedDedup.absentKeys());
    }

    @Test
    void single_attempt_and_no_file_by_default() {
        Injector injector = Guice.createInjector(new LayoffsModule(LayoffsConfig.defaults()));

        assertSame(RetryPolicy.NEVER, injector.getInstance(RetryPolicy.class));
        assertInstanceOf(CollectingDeadLetterSink.class, injector.getInstance(DEAD_LETTERS));
    }

    @Test
    void retries_and_dead_letter_file_come_from_the_config(@TempDir Path dir) {
        Path file = dir.resolve("failed/normalize.jsonl");
        Injector injector = Guice.createInjector(new LayoffsModule(config(1, 5, AbsentKeyMatching.EQUAL, 3, file)));

        RetryPolicy retry = injector.getInstance(RetryPolicy.class);
        ExponentialBackoffRetryPolicy backoff = assertInstanceOf(ExponentialBackoffRetryPolicy.class, retry);
        assertEquals(3, backoff.maxAttempts());
        FileDeadLetterSink<RawLayoff> sink = assertInstanceOf(FileDeadLetterSink.class, injector.getInstance(DEAD_LETTERS));
        assertEquals(file, sink.file());
        assertTrue(Files.exists(file));
    }

    @Test
    void removal_listener_reaches_the_cleaning_pipeline() {
        List<String> removed = new ArrayList<>();
        Injector injector = Guice.createInjector(new LayoffsModule(LayoffsConfig.defaults(), (stage, r) -> removed.add(stage)));

        CleaningResult result = injector.getInstance(CleaningPipeline.class).clean(dataset(
                RawLayoff.builder(1).company("Acme").totalLaidOff(5).build(),
                RawLayoff.builder(2).company("Acme").totalLaidOff(5).build(),
                RawLayoff.builder(3).company("Empty").build()));

        assertEquals(1, result.records().size());
        assertEquals(List.of(Deduplicator.NAME, RowPruner.NAME), removed);
        assertEquals(1, injector.getInstance(MetricRegistry.class).counter("cleaning.prune.removed").getCount());
    }

    private static LayoffsConfig config(int workers, int band, AbsentKeyMatching absentKeys, int retries, Path deadLetters) {
        LayoffsConfig d = LayoffsConfig.defaults();
        return new LayoffsConfig(d.input(), d.outputDir(), workers, band, d.datePattern(), List.of("Fin=Finance"),
                absentKeys, retries, deadLetters);
    }
}
