package io.layoffs.app;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.layoffs.analytics.DatasetOverview;
import io.layoffs.analytics.LayoffAnalytics;
import io.layoffs.analytics.LayoffReports;
import io.layoffs.analytics.RankedCompany;
import io.layoffs.analytics.YearRanking;
import io.layoffs.cleaning.AbsentKeyMatching;
import io.layoffs.cleaning.CleaningPipeline;
import io.layoffs.cleaning.CleaningResult;
import io.layoffs.config.LayoffsConfig;
import io.layoffs.core.Record;
import io.layoffs.csv.LayoffCsvSink;
import io.layoffs.csv.LayoffCsvSource;
import io.layoffs.csv.ReportCsvWriter;
import io.layoffs.error.StageFailedException;
import io.layoffs.model.RawLayoff;
import io.layoffs.source.Sources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI that cleans a layoffs CSV export and writes the cleaned rows plus the trend and ranking reports.
 * Options left unset fall back to {@link LayoffsConfig#fromEnv()}.
 */
@CommandLine.Command(name = "layoffs", mixinStandardHelpOptions = true,
        description = "Clean a layoffs CSV and derive monthly, rolling and top-company reports")
public final class LayoffsMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(LayoffsMain.class);

    public static final String CLEANED_FILE = "layoffs_cleaned.csv";

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-i", "--input"}, description = "Raw layoffs CSV")
    Path input;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output directory")
    Path outDir;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Normalizer worker threads")
    Integer workers;

    @CommandLine.Option(names = {"-b", "--band"}, description = "Ranks kept per year (dense rank)")
    Integer band;

    @CommandLine.Option(names = "--date-pattern", description = "Pattern of the raw date column, e.g. M/d/uuuu")
    String datePattern;

    @CommandLine.Option(names = "--industry-prefix", split = ",", description = "PREFIX=LABEL canonicalization rule, first match wins (repeatable)")
    List<String> industryPrefixes;

    @CommandLine.Option(names = "--absent-keys", description = "How absent key fields compare in dedup: ${COMPLETION-CANDIDATES}")
    AbsentKeyMatching absentKeys;

    @CommandLine.Option(names = "--retries", description = "Attempts per record when normalizing fails with a checked error")
    Integer retryAttempts;

    @CommandLine.Option(names = "--dead-letter", description = "JSON-lines file for records that failed normalization")
    Path deadLetterFile;

    public static void main(String[] args) {
        int code = new CommandLine(new LayoffsMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        LayoffsConfig cfg;
        try {
            cfg = LayoffsConfig.fromEnv(overrides());
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        Injector injector = Guice.createInjector(new LayoffsModule(cfg));
        List<Record<RawLayoff>> raw;
        try (LayoffCsvSource source = new LayoffCsvSource(cfg.input())) {
            raw = Sources.drain(source);
        } catch (IOException e) {
            log.error("cannot load {}", cfg.input(), e);
            err.println("Cannot read input " + cfg.input() + ": " + e.getMessage());
            return 1;
        }

        try {
            CleaningResult cleaned = injector.getInstance(CleaningPipeline.class).clean(raw);
            LayoffReports reports = injector.getInstance(LayoffAnalytics.class).analyze(cleaned.cleaned());

            Files.createDirectories(cfg.outputDir());
            Path cleanedFile = cfg.outputDir().resolve(CLEANED_FILE);
            Files.deleteIfExists(cleanedFile);
            new LayoffCsvSink(cleanedFile).acceptBatch(cleaned.records());
            List<Path> written = new ArrayList<>();
            written.add(cleanedFile);
            written.addAll(new ReportCsvWriter(cfg.outputDir()).write(reports));

            printSummary(out, cleaned, reports, injector.getInstance(MetricRegistry.class));
            out.println("Wrote " + written.size() + " file(s) to " + cfg.outputDir());
            out.flush();
            return 0;
        } catch (StageFailedException e) {
            err.println("Cleaning failed: " + e.getMessage());
            if (cfg.deadLetterFile() != null) err.println("Failed records: " + cfg.deadLetterFile());
            return 1;
        } catch (ProvisionException e) {
            log.error("cannot set up the cleaning stages", e);
            err.println("Cannot start: " + (e.getCause() != null ? e.getCause().getMessage() : e.getMessage()));
            return 1;
        } catch (IOException e) {
            log.error("cannot write results to {}", cfg.outputDir(), e);
            err.println("Cannot write output to " + cfg.outputDir() + ": " + e.getMessage());
            return 1;
        }
    }

    /** Options given on the command line, keyed like {@link LayoffsConfig}'s system properties. */
    Map<String, String> overrides() {
        Map<String, String> out = new LinkedHashMap<>();
        if (input != null) out.put(LayoffsConfig.INPUT, input.toString());
        if (outDir != null) out.put(LayoffsConfig.OUTPUT_DIR, outDir.toString());
        if (workers != null) out.put(LayoffsConfig.WORKERS, workers.toString());
        if (band != null) out.put(LayoffsConfig.BAND, band.toString());
        if (datePattern != null) out.put(LayoffsConfig.DATE_PATTERN, datePattern);
        if (industryPrefixes != null && !industryPrefixes.isEmpty()) {
            out.put(LayoffsConfig.INDUSTRY_PREFIXES, String.join(",", industryPrefixes));
        }
        if (absentKeys != null) out.put(LayoffsConfig.ABSENT_KEYS, absentKeys.name());
        if (retryAttempts != null) out.put(LayoffsConfig.RETRY_ATTEMPTS, retryAttempts.toString());
        if (deadLetterFile != null) out.put(LayoffsConfig.DEAD_LETTER_FILE, deadLetterFile.toString());
        return out;
    }

    private static void printSummary(PrintWriter out, CleaningResult cleaned, LayoffReports reports, MetricRegistry registry) {
        out.println("Cleaning: raw=" + cleaned.inputCount() + " cleaned=" + cleaned.records().size()
                + " duplicates=" + cleaned.duplicateIds().size() + " pruned=" + cleaned.prunedIds().size()
                + " industriesFilled=" + cleaned.industriesFilled() + " unparsedDates=" + cleaned.unparsedDates());
        DatasetOverview o = reports.overview();
        out.println("Overview: events=" + o.events() + " maxTotal=" + o.maxTotalLaidOff()
                + " maxPct=" + o.maxPercentageLaidOff() + " dates=" + o.firstDate() + ".." + o.lastDate()
                + " fullShutdowns=" + o.fullShutdowns().size());
        out.println("Top companies by year:");
        for (YearRanking y : reports.topCompaniesByYear()) {
            StringBuilder line = new StringBuilder("  ").append(y.year()).append(':');
            for (RankedCompany c : y.companies()) {
                line.append(' ').append(c.rank()).append('.').append(c.company()).append('=').append(c.yearlyTotal());
            }
            out.println(line);
        }
        out.println("Stage timings (ms p50): " + stageTimings(registry));
    }

    private static String stageTimings(MetricRegistry registry) {
        StringBuilder sb = new StringBuilder();
        registry.getTimers((name, metric) -> name.startsWith("stage.")).forEach((name, timer) -> {
            if (sb.length() > 0) sb.append(' ');
            sb.append(name, "stage.".length(), name.length() - ".time".length())
              .append('=').append(String.format("%.3f", timer.getSnapshot().getMedian() / 1_000_000.0));
        });
        return sb.toString();
    }
}
