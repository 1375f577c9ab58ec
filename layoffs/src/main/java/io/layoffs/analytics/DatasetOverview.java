package io.layoffs.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Headline figures of a cleaned dataset. Fields are null when no record carries the value.
 *
 * @param fullShutdowns events where the whole workforce was let go, most funded first
 */
public record DatasetOverview(
        int events,
        Integer maxTotalLaidOff,
        Double maxPercentageLaidOff,
        LocalDate firstDate,
        LocalDate lastDate,
        List<FullShutdown> fullShutdowns
) {
    public DatasetOverview {
        fullShutdowns = List.copyOf(fullShutdowns);
    }

    public record FullShutdown(String company, Integer totalLaidOff, BigDecimal fundsRaised, LocalDate date) {}
}
