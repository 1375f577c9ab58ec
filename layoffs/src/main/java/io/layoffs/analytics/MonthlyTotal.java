package io.layoffs.analytics;

import java.time.YearMonth;

public record MonthlyTotal(YearMonth month, long total) {}
