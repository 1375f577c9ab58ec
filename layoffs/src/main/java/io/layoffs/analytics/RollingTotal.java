package io.layoffs.analytics;

import java.time.YearMonth;

public record RollingTotal(YearMonth month, long total, long runningTotal) {}
