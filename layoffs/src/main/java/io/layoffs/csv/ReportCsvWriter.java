package io.layoffs.csv;

import io.layoffs.analytics.Dimension;
import io.layoffs.analytics.DimensionTotal;
import io.layoffs.analytics.LayoffReports;
import io.layoffs.analytics.MonthlyTotal;
import io.layoffs.analytics.RankedCompany;
import io.layoffs.analytics.RollingTotal;
import io.layoffs.analytics.YearRanking;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes each report to its own CSV file under one directory, replacing earlier runs.
 */
public class ReportCsvWriter {
    public static final String MONTHLY = "monthly_totals.csv";
    public static final String ROLLING = "rolling_totals.csv";
    public static final String TOP_BY_YEAR = "top_companies_by_year.csv";

    private final Path outDir;

    public ReportCsvWriter(Path outDir) throws IOException {
        this.outDir = outDir;
        Files.createDirectories(outDir);
    }

    /** @return the files written, in write order */
    public List<Path> write(LayoffReports reports) throws IOException {
        List<Path> written = new ArrayList<>();
        written.add(writeMonthly(reports.monthly()));
        written.add(writeRolling(reports.rolling()));
        written.add(writeTopByYear(reports.topCompaniesByYear()));
        for (Dimension d : Dimension.values()) {
            List<DimensionTotal> totals = reports.totalsByDimension().get(d);
            if (totals != null) written.add(writeDimension(d, totals));
        }
        return written;
    }

    Path writeMonthly(List<MonthlyTotal> monthly) throws IOException {
        Path out = outDir.resolve(MONTHLY);
        try (CSVPrinter p = printer(out, "month", "total_laid_off")) {
            for (MonthlyTotal m : monthly) p.printRecord(m.month(), m.total());
        }
        return out;
    }

    Path writeRolling(List<RollingTotal> rolling) throws IOException {
        Path out = outDir.resolve(ROLLING);
        try (CSVPrinter p = printer(out, "month", "total_laid_off", "rolling_total")) {
            for (RollingTotal r : rolling) p.printRecord(r.month(), r.total(), r.runningTotal());
        }
        return out;
    }

    Path writeTopByYear(List<YearRanking> ranking) throws IOException {
        Path out = outDir.resolve(TOP_BY_YEAR);
        try (CSVPrinter p = printer(out, "year", "rank", "company", "total_laid_off")) {
            for (YearRanking y : ranking) {
                for (RankedCompany c : y.companies()) p.printRecord(y.year(), c.rank(), c.company(), c.yearlyTotal());
            }
        }
        return out;
    }

    Path writeDimension(Dimension dimension, List<DimensionTotal> totals) throws IOException {
        String column = dimension.name().toLowerCase(Locale.ROOT);
        Path out = outDir.resolve("totals_by_" + column + ".csv");
        try (CSVPrinter p = printer(out, column, "total_laid_off")) {
            for (DimensionTotal t : totals) p.printRecord(t.key(), t.total());
        }
        return out;
    }

    private static CSVPrinter printer(Path file, String... header) throws IOException {
        BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new CSVPrinter(w, CSVFormat.DEFAULT.builder().setHeader(header).build());
    }
}
