package io.layoffs.csv;

import java.util.List;

/**
 * Column names of the layoffs CSV layout, in file order.
 */
public final class LayoffColumns {
    public static final String COMPANY = "company";
    public static final String LOCATION = "location";
    public static final String INDUSTRY = "industry";
    public static final String TOTAL_LAID_OFF = "total_laid_off";
    public static final String PERCENTAGE_LAID_OFF = "percentage_laid_off";
    public static final String DATE = "date";
    public static final String STAGE = "stage";
    public static final String COUNTRY = "country";
    public static final String FUNDS_RAISED = "funds_raised_millions";
    static final String FUNDS_RAISED_ALIAS = "funds_raised";

    public static final List<String> ALL = List.of(COMPANY, LOCATION, INDUSTRY, TOTAL_LAID_OFF,
            PERCENTAGE_LAID_OFF, DATE, STAGE, COUNTRY, FUNDS_RAISED);

    private LayoffColumns() {}
}
