package io.layoffs.app;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.layoffs.analytics.DimensionTotals;
import io.layoffs.analytics.LayoffAnalytics;
import io.layoffs.analytics.MonthlyAggregator;
import io.layoffs.analytics.OverviewCalculator;
import io.layoffs.analytics.PartitionRanker;
import io.layoffs.analytics.RollingTotalComputer;
import io.layoffs.cleaning.CleaningPipeline;
import io.layoffs.cleaning.Deduplicator;
import io.layoffs.cleaning.IndustryCanonicalizer;
import io.layoffs.cleaning.LayoffDateParser;
import io.layoffs.cleaning.Normalizer;
import io.layoffs.cleaning.NullFiller;
import io.layoffs.cleaning.RowPruner;
import io.layoffs.config.LayoffsConfig;
import io.layoffs.core.RemovalListener;
import io.layoffs.error.CollectingDeadLetterSink;
import io.layoffs.error.DeadLetterSink;
import io.layoffs.error.FileDeadLetterSink;
import io.layoffs.metrics.Metrics;
import io.layoffs.model.LayoffRecord;
import io.layoffs.model.RawLayoff;
import io.layoffs.retry.ExponentialBackoffRetryPolicy;
import io.layoffs.retry.RetryPolicy;
import io.layoffs.runtime.ParallelTransformStage;
import io.layoffs.runtime.StageRunner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeUnit;

public class LayoffsModule extends AbstractModule {
    static final long RETRY_BASE_MILLIS = 50;
    static final long RETRY_MAX_MILLIS = 2_000;

    private final LayoffsConfig config;
    private final RemovalListener removals;

    public LayoffsModule(LayoffsConfig config) { this(config, RemovalListener.NONE); }

    public LayoffsModule(LayoffsConfig config, RemovalListener removals) {
        this.config = config;
        this.removals = removals;
    }

    @Override
    protected void configure() {
        bind(LayoffsConfig.class).toInstance(config);
        bind(RemovalListener.class).toInstance(removals);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton IndustryCanonicalizer industryCanonicalizer() { return IndustryCanonicalizer.parse(config.industryPrefixes()); }

    @Provides @Singleton LayoffDateParser dateParser() { return new LayoffDateParser(config.datePattern()); }

    @Provides @Singleton Normalizer normalizer(IndustryCanonicalizer industries, LayoffDateParser dates) { return new Normalizer(industries, dates); }

    @Provides @Singleton Deduplicator<RawLayoff> deduplicator() { return Deduplicator.forRaw(config.absentKeys()); }

    @Provides @Singleton Deduplicator<LayoffRecord> cleanedDeduplicator() { return Deduplicator.forCleaned(config.absentKeys()); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        if (config.retryAttempts() <= 1) return RetryPolicy.NEVER;
        return new ExponentialBackoffRetryPolicy(config.retryAttempts(), RETRY_BASE_MILLIS, RETRY_MAX_MILLIS);
    }

    @Provides @Singleton DeadLetterSink<RawLayoff> deadLetters() {
        if (config.deadLetterFile() == null) return new CollectingDeadLetterSink<>();
        try {
            return new FileDeadLetterSink<>(config.deadLetterFile());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open dead-letter file " + config.deadLetterFile(), e);
        }
    }

    @Provides @Singleton PartitionRanker partitionRanker() { return new PartitionRanker(config.topBand()); }

    @Provides @Singleton CleaningPipeline cleaningPipeline(Deduplicator<RawLayoff> dedup, Normalizer normalizer,
                                                           Deduplicator<LayoffRecord> cleanedDedup, RetryPolicy retry,
                                                           DeadLetterSink<RawLayoff> deadLetters, MetricRegistry registry,
                                                           Metrics metrics, RemovalListener removals) {
        ParallelTransformStage<RawLayoff, LayoffRecord> normalize = new ParallelTransformStage<>(Normalizer.NAME, normalizer,
                config.workers(), retry, registry, TimeUnit.MINUTES.toMillis(10), deadLetters);
        return new CleaningPipeline(dedup, normalize, new NullFiller(), new RowPruner(), cleanedDedup,
                new StageRunner(metrics), removals);
    }

    @Provides @Singleton LayoffAnalytics analytics(PartitionRanker ranker, MetricRegistry registry) {
        return new LayoffAnalytics(new MonthlyAggregator(), new RollingTotalComputer(), ranker, new DimensionTotals(),
                new OverviewCalculator(), registry);
    }
}
