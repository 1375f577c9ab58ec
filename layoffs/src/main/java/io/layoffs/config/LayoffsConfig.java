package io.layoffs.config;

import io.layoffs.analytics.PartitionRanker;
import io.layoffs.cleaning.AbsentKeyMatching;
import io.layoffs.cleaning.IndustryCanonicalizer;
import io.layoffs.cleaning.LayoffDateParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime settings. Each setting is looked up as an explicit override (command line), then a system
 * property, then an environment variable, then the default. Values are only parsed and validated after
 * that lookup, so an override hides a broken environment value.
 *
 * @param industryPrefixes ordered {@code PREFIX=LABEL} canonicalization rules
 * @param retryAttempts    attempts per record in the normalizer, 1 disables retries
 * @param deadLetterFile   JSON-lines file for records the normalizer gave up on, null to keep them in memory only
 */
public record LayoffsConfig(
        Path input,
        Path outputDir,
        int workers,
        int topBand,
        String datePattern,
        List<String> industryPrefixes,
        AbsentKeyMatching absentKeys,
        int retryAttempts,
        Path deadLetterFile
) {
    public static final List<String> DEFAULT_INDUSTRY_PREFIXES = List.of("Crypto=Crypto");

    public static final String INPUT = "layoffs.in";
    public static final String OUTPUT_DIR = "layoffs.out";
    public static final String WORKERS = "layoffs.workers";
    public static final String BAND = "layoffs.band";
    public static final String DATE_PATTERN = "layoffs.datePattern";
    public static final String INDUSTRY_PREFIXES = "layoffs.industryPrefixes";
    public static final String ABSENT_KEYS = "layoffs.absentKeys";
    public static final String RETRY_ATTEMPTS = "layoffs.retryAttempts";
    public static final String DEAD_LETTER_FILE = "layoffs.deadLetterFile";

    public LayoffsConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1, was " + workers);
        if (topBand < 1) throw new IllegalArgumentException("topBand must be >= 1, was " + topBand);
        if (retryAttempts < 1) throw new IllegalArgumentException("retryAttempts must be >= 1, was " + retryAttempts);
        if (datePattern == null || datePattern.isBlank()) throw new IllegalArgumentException("datePattern must not be blank");
        industryPrefixes = List.copyOf(industryPrefixes);
        // fail here rather than when the stages are first built
        new LayoffDateParser(datePattern);
        IndustryCanonicalizer.parse(industryPrefixes);
        if (absentKeys == null) absentKeys = AbsentKeyMatching.EQUAL;
    }

    public static LayoffsConfig defaults() {
        return new LayoffsConfig(Path.of("layoffs.csv"), Path.of("./out"), 1, PartitionRanker.DEFAULT_BAND,
                LayoffDateParser.DEFAULT_PATTERN, DEFAULT_INDUSTRY_PREFIXES, AbsentKeyMatching.EQUAL, 1, null);
    }

    public static LayoffsConfig fromEnv() {
        return from(System.getenv(), Map.of());
    }

    /**
     * @param overrides values keyed by property name ({@link #BAND} etc.) that win over everything else
     * @throws IllegalArgumentException if a resolved value is malformed or out of range
     */
    public static LayoffsConfig fromEnv(Map<String, String> overrides) {
        return from(System.getenv(), overrides);
    }

    static LayoffsConfig from(Map<String, String> env) {
        return from(env, Map.of());
    }

    static LayoffsConfig from(Map<String, String> env, Map<String, String> overrides) {
        Path in = Path.of(setting(env, overrides, INPUT, "LAYOFFS_IN", "layoffs.csv"));
        Path out = Path.of(setting(env, overrides, OUTPUT_DIR, "LAYOFFS_OUT", "./out"));
        int workers = integer(WORKERS, setting(env, overrides, WORKERS, "LAYOFFS_WORKERS", "1"));
        int band = integer(BAND, setting(env, overrides, BAND, "LAYOFFS_BAND", String.valueOf(PartitionRanker.DEFAULT_BAND)));
        String pattern = setting(env, overrides, DATE_PATTERN, "LAYOFFS_DATE_PATTERN", LayoffDateParser.DEFAULT_PATTERN);
        String prefixes = setting(env, overrides, INDUSTRY_PREFIXES, "LAYOFFS_INDUSTRY_PREFIXES", String.join(",", DEFAULT_INDUSTRY_PREFIXES));
        AbsentKeyMatching absent = AbsentKeyMatching.valueOf(
                setting(env, overrides, ABSENT_KEYS, "LAYOFFS_ABSENT_KEYS", AbsentKeyMatching.EQUAL.name()).trim().toUpperCase(Locale.ROOT));
        int attempts = integer(RETRY_ATTEMPTS, setting(env, overrides, RETRY_ATTEMPTS, "LAYOFFS_RETRY_ATTEMPTS", "1"));
        String deadLetter = setting(env, overrides, DEAD_LETTER_FILE, "LAYOFFS_DEAD_LETTER_FILE", "");
        return new LayoffsConfig(in, out, workers, band, pattern, splitList(prefixes), absent, attempts,
                deadLetter.isBlank() ? null : Path.of(deadLetter.trim()));
    }

    private static String setting(Map<String, String> env, Map<String, String> overrides,
                                  String property, String variable, String fallback) {
        String override = overrides.get(property);
        if (override != null) return override;
        return System.getProperty(property, env.getOrDefault(variable, fallback));
    }

    private static int integer(String property, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(property + " must be an integer, was '" + value + "'", e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }
}
