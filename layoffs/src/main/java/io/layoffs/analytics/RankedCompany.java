package io.layoffs.analytics;

/**
 * One company's layoffs within a year and its dense rank in that year.
 */
public record RankedCompany(String company, int year, long yearlyTotal, int rank) {}
