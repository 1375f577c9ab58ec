package io.layoffs.analytics;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.layoffs.model.LayoffRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds every report from a cleaned dataset. The rolling series is computed from the monthly one, so
 * both always cover the same months.
 */
public class LayoffAnalytics {
    private static final Logger log = LoggerFactory.getLogger(LayoffAnalytics.class);

    private final MonthlyAggregator monthlyAggregator;
    private final RollingTotalComputer rollingTotals;
    private final PartitionRanker ranker;
    private final DimensionTotals dimensionTotals;
    private final OverviewCalculator overviews;
    private final MetricRegistry registry;

    public LayoffAnalytics(MonthlyAggregator monthlyAggregator,
                           RollingTotalComputer rollingTotals,
                           PartitionRanker ranker,
                           DimensionTotals dimensionTotals,
                           OverviewCalculator overviews,
                           MetricRegistry registry) {
        this.monthlyAggregator = Objects.requireNonNull(monthlyAggregator);
        this.rollingTotals = Objects.requireNonNull(rollingTotals);
        this.ranker = Objects.requireNonNull(ranker);
        this.dimensionTotals = Objects.requireNonNull(dimensionTotals);
        this.overviews = Objects.requireNonNull(overviews);
        this.registry = Objects.requireNonNull(registry);
    }

    public LayoffReports analyze(Collection<LayoffRecord> cleaned) {
        try (Timer.Context ignored = registry.timer("analytics.time").time()) {
            List<MonthlyTotal> monthly = monthlyAggregator.aggregate(cleaned);
            List<RollingTotal> rolling = rollingTotals.compute(monthly);
            List<YearRanking> ranking = ranker.rank(cleaned);
            Map<Dimension, List<DimensionTotal>> byDimension = new EnumMap<>(Dimension.class);
            for (Dimension d : Dimension.values()) {
                byDimension.put(d, dimensionTotals.totals(cleaned, d));
            }
            DatasetOverview overview = overviews.overview(cleaned);
            log.info("analyzed {} record(s): months={} years={} band={}", cleaned.size(), monthly.size(),
                    ranking.size(), ranker.band());
            return new LayoffReports(monthly, rolling, ranking, byDimension, overview);
        }
    }
}
