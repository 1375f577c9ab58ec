package io.layoffs.analytics;

import java.util.List;

/**
 * Top band of one year, ordered by rank.
 */
public record YearRanking(int year, List<RankedCompany> companies) {
    public YearRanking {
        companies = List.copyOf(companies);
    }
}
