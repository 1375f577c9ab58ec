package io.layoffs.analytics;

import java.util.List;
import java.util.Map;

/**
 * Everything derived from one cleaned dataset.
 */
public record LayoffReports(
        List<MonthlyTotal> monthly,
        List<RollingTotal> rolling,
        List<YearRanking> topCompaniesByYear,
        Map<Dimension, List<DimensionTotal>> totalsByDimension,
        DatasetOverview overview
) {
    public LayoffReports {
        monthly = List.copyOf(monthly);
        rolling = List.copyOf(rolling);
        topCompaniesByYear = List.copyOf(topCompaniesByYear);
        totalsByDimension = Map.copyOf(totalsByDimension);
    }
}
