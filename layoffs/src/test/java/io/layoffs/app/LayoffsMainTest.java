package io.layoffs.app;

import io.layoffs.cleaning.AbsentKeyMatching;
import io.layoffs.config.LayoffsConfig;
import io.layoffs.csv.ReportCsvWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LayoffsMainTest {
    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new LayoffsMain());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path rawCsv() throws Exception {
        Path f = dir.resolve("layoffs.csv");
        Files.write(f, List.of(
                "company,location,industry,total_laid_off,percentage_laid_off,date,stage,country,funds_raised_millions",
                "Acme,Austin,Retail,100,0.1,1/15/2023,Series B,United States,50",
                "Acme,Austin,Retail,100,0.1,1/15/2023,Series B,United States,50",
                "Acme,Austin,,40,,2/3/2023,Series B,United States.,50",
                "Coinbase,SF Bay Area,Crypto Currency,950,0.18,1/10/2023,Post-IPO,United States,549",
                "Ghost,Remote,Tech,NULL,NULL,3/1/2023,Seed,United States,1"), StandardCharsets.UTF_8);
        return f;
    }

    @Test
    void cleans_and_writes_every_report() throws Exception {
        Path outDir = dir.resolve("out");

        int code = run("--input", rawCsv().toString(), "--out", outDir.toString(), "--workers", "2", "--band", "2");

        assertEquals(0, code, err.toString());
        assertTrue(Files.exists(outDir.resolve(LayoffsMain.CLEANED_FILE)));
        assertTrue(Files.exists(outDir.resolve(ReportCsvWriter.MONTHLY)));
        assertTrue(Files.exists(outDir.resolve(ReportCsvWriter.TOP_BY_YEAR)));
        assertTrue(Files.exists(outDir.resolve("totals_by_country.csv")));

        List<String> cleaned = Files.readAllLines(outDir.resolve(LayoffsMain.CLEANED_FILE), StandardCharsets.UTF_8);
        assertEquals(4, cleaned.size());
        assertTrue(cleaned.contains("Acme,Austin,Retail,40,,2023-02-03,Series B,United States,50"));
        assertTrue(cleaned.contains("Coinbase,SF Bay Area,Crypto,950,0.18,2023-01-10,Post-IPO,United States,549"));

        assertEquals(List.of("month,total_laid_off,rolling_total", "2023-01,1050,1050", "2023-02,40,1090"),
                Files.readAllLines(outDir.resolve(ReportCsvWriter.ROLLING), StandardCharsets.UTF_8));

        String summary = out.toString();
        assertTrue(summary.contains("Cleaning: raw=5 cleaned=3 duplicates=1 pruned=1 industriesFilled=1"), summary);
        assertTrue(summary.contains("2023: 1.Coinbase=950 2.Acme=140"), summary);
        assertTrue(summary.contains("Wrote 9 file(s)"), summary);
    }

    @Test
    void missing_input_exits_with_one() {
        int code = run("--input", dir.resolve("nope.csv").toString(), "--out", dir.resolve("out").toString());
        assertEquals(1, code);
        assertTrue(err.toString().contains("Cannot read input"));
    }

    @Test
    void invalid_arguments_exit_with_two() {
        assertEquals(2, run("--band", "0"));
        assertTrue(err.toString().contains("Invalid configuration"));
        assertEquals(2, run("--absent-keys", "SOMETIMES"));
    }

    @Test
    void command_line_options_become_config_overrides() {
        LayoffsMain main = new LayoffsMain();
        new CommandLine(main).parseArgs("-w", "3", "--absent-keys", "DISTINCT",
                "--industry-prefix", "Fin=Finance,Crypto", "--date-pattern", "d.M.uuuu",
                "--retries", "4", "--dead-letter", "failed.jsonl");

        assertEquals(Map.of(
                LayoffsConfig.WORKERS, "3",
                LayoffsConfig.ABSENT_KEYS, "DISTINCT",
                LayoffsConfig.INDUSTRY_PREFIXES, "Fin=Finance,Crypto",
                LayoffsConfig.DATE_PATTERN, "d.M.uuuu",
                LayoffsConfig.RETRY_ATTEMPTS, "4",
                LayoffsConfig.DEAD_LETTER_FILE, "failed.jsonl"), main.overrides());

        LayoffsConfig cfg = LayoffsConfig.fromEnv(main.overrides());
        assertEquals(3, cfg.workers());
        assertEquals(AbsentKeyMatching.DISTINCT, cfg.absentKeys());
        assertEquals(List.of("Fin=Finance", "Crypto"), cfg.industryPrefixes());
        assertEquals(4, cfg.retryAttempts());
        assertEquals(Path.of("failed.jsonl"), cfg.deadLetterFile());
    }

    @Test
    void valid_option_hides_a_broken_setting_underneath() throws Exception {
        System.setProperty(LayoffsConfig.BAND, "zero");
        try {
            int code = run("--input", rawCsv().toString(), "--out", dir.resolve("out").toString(), "--band", "2");
            assertEquals(0, code, err.toString());

            assertEquals(2, run("--input", rawCsv().toString(), "--out", dir.resolve("out").toString()));
            assertTrue(err.toString().contains(LayoffsConfig.BAND), err.toString());
        } finally {
            System.clearProperty(LayoffsConfig.BAND);
        }
    }

    @Test
    void runs_with_retries_and_a_dead_letter_file() throws Exception {
        Path failed = dir.resolve("dlq/normalize.jsonl");

        int code = run("--input", rawCsv().toString(), "--out", dir.resolve("out").toString(),
                "--retries", "3", "--dead-letter", failed.toString());

        assertEquals(0, code, err.toString());
        assertTrue(Files.exists(failed));
        assertEquals(List.of(), Files.readAllLines(failed, StandardCharsets.UTF_8));
        assertEquals(2, run("--retries", "0"));
    }
}
