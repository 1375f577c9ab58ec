package io.layoffs.csv;

import io.layoffs.core.Record;
import io.layoffs.core.Source;
import io.layoffs.model.RawLayoff;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a layoffs CSV export and emits one {@link RawLayoff} per data row, numbered from 0 in file
 * order; ids are the 1-based row numbers. Text is passed on untrimmed. Empty cells and the literal
 * {@code NULL} are absent, and numbers that do not parse are absent as well.
 */
public class LayoffCsvSource implements Source<RawLayoff> {
    private static final Logger log = LoggerFactory.getLogger(LayoffCsvSource.class);
    private static final String NULL_LITERAL = "NULL";

    private final Path file;
    private final List<RawLayoff> rows;
    private int idx = 0;
    private int unparsedNumbers = 0;

    /**
     * @throws IOException if the file cannot be read or has no {@code company} column
     */
    public LayoffCsvSource(Path file) throws IOException {
        this.file = file;
        this.rows = read(file);
    }

    private List<RawLayoff> read(Path path) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .build();
        List<RawLayoff> out = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            Map<String, String> headers = headerIndex(parser.getHeaderNames());
            if (!headers.containsKey(LayoffColumns.COMPANY)) {
                throw new IOException("no '" + LayoffColumns.COMPANY + "' column in " + path + ", found " + parser.getHeaderNames());
            }
            long id = 1;
            for (CSVRecord record : parser) {
                out.add(RawLayoff.builder(id++)
                        .company(text(record, headers, LayoffColumns.COMPANY))
                        .location(text(record, headers, LayoffColumns.LOCATION))
                        .industry(text(record, headers, LayoffColumns.INDUSTRY))
                        .totalLaidOff(integer(record, headers, LayoffColumns.TOTAL_LAID_OFF))
                        .percentageLaidOff(decimal(record, headers, LayoffColumns.PERCENTAGE_LAID_OFF))
                        .date(text(record, headers, LayoffColumns.DATE))
                        .stage(text(record, headers, LayoffColumns.STAGE))
                        .country(text(record, headers, LayoffColumns.COUNTRY))
                        .fundsRaised(money(record, headers))
                        .build());
            }
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            throw new IOException("malformed CSV " + path + ": " + e.getMessage(), e);
        }
        log.info("loaded {} row(s) from {} ({} unparseable number(s) treated as absent)", out.size(), path, unparsedNumbers);
        return out;
    }

    private static Map<String, String> headerIndex(List<String> names) {
        Map<String, String> out = new HashMap<>();
        for (String name : names) {
            if (name == null) continue;
            out.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), name);
        }
        String alias = out.get(LayoffColumns.FUNDS_RAISED_ALIAS);
        if (alias != null) out.putIfAbsent(LayoffColumns.FUNDS_RAISED, alias);
        return out;
    }

    private static String text(CSVRecord record, Map<String, String> headers, String column) {
        String header = headers.get(column);
        if (header == null || !record.isSet(header)) return null;
        String value = record.get(header);
        if (value == null || value.isEmpty() || NULL_LITERAL.equals(value.trim())) return null;
        return value;
    }

    private Integer integer(CSVRecord record, Map<String, String> headers, String column) {
        String value = text(record, headers, column);
        if (value == null || value.isBlank()) return null;
        try {
            // exports sometimes carry counts as "12.0"
            return new BigDecimal(value.trim()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            return unparsed(record, column, value);
        }
    }

    private Double decimal(CSVRecord record, Map<String, String> headers, String column) {
        String value = text(record, headers, column);
        if (value == null || value.isBlank()) return null;
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return unparsed(record, column, value);
        }
    }

    private BigDecimal money(CSVRecord record, Map<String, String> headers) {
        String value = text(record, headers, LayoffColumns.FUNDS_RAISED);
        if (value == null || value.isBlank()) return null;
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return unparsed(record, LayoffColumns.FUNDS_RAISED, value);
        }
    }

    private <T> T unparsed(CSVRecord record, String column, String value) {
        unparsedNumbers++;
        log.warn("row {} column {}: '{}' is not a number, treating as absent", record.getRecordNumber(), column, value);
        return null;
    }

    @Override
    public Optional<Record<RawLayoff>> poll() {
        if (idx >= rows.size()) return Optional.empty();
        Record<RawLayoff> r = Record.of(idx, rows.get(idx));
        idx++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return idx >= rows.size();
    }

    public int size() { return rows.size(); }

    public int unparsedNumbers() { return unparsedNumbers; }

    public Path file() { return file; }
}
