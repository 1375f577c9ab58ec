package io.layoffs.analytics;

import com.codahale.metrics.MetricRegistry;
import io.layoffs.model.LayoffRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static io.layoffs.model.LayoffFixtures.dated;
import static org.junit.jupiter.api.Assertions.*;

class LayoffAnalyticsTest {
    @Test
    void builds_all_reports_from_one_dataset() {
        MetricRegistry registry = new MetricRegistry();
        LayoffAnalytics analytics = new LayoffAnalytics(new MonthlyAggregator(), new RollingTotalComputer(),
                new PartitionRanker(), new DimensionTotals(), new OverviewCalculator(), registry);
        List<LayoffRecord> cleaned = List.of(
                dated("A", 10, LocalDate.of(2023, 1, 5)),
                dated("B", 5, LocalDate.of(2023, 2, 5)),
                dated("A", 3, LocalDate.of(2023, 2, 6)));

        LayoffReports reports = analytics.analyze(cleaned);

        assertEquals(List.of(YearMonth.of(2023, 1), YearMonth.of(2023, 2)),
                reports.rolling().stream().map(RollingTotal::month).toList());
        assertEquals(18L, reports.rolling().get(1).runningTotal());
        assertEquals(reports.monthly().size(), reports.rolling().size());
        assertEquals("A", reports.topCompaniesByYear().get(0).companies().get(0).company());
        assertEquals(Dimension.values().length, reports.totalsByDimension().size());
        assertEquals(new DimensionTotal("Tech", 18), reports.totalsByDimension().get(Dimension.INDUSTRY).get(0));
        assertEquals(3, reports.overview().events());
        assertEquals(1, registry.timer("analytics.time").getCount());
    }
}
