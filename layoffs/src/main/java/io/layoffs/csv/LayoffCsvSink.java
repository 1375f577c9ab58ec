package io.layoffs.csv;

import io.layoffs.core.BatchSink;
import io.layoffs.core.Record;
import io.layoffs.model.LayoffRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Appends cleaned records to a CSV file in the loader's column layout, writing the header when the file
 * is new. Dates are written as ISO {@code yyyy-MM-dd}; absent values as empty cells.
 */
public class LayoffCsvSink implements BatchSink<LayoffRecord> {
    private final Path file;

    public LayoffCsvSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    @Override
    public void accept(Record<LayoffRecord> record) throws IOException {
        acceptBatch(List.of(record));
    }

    @Override
    public synchronized void acceptBatch(List<Record<LayoffRecord>> records) throws IOException {
        boolean exists = Files.exists(file);
        CSVFormat format = exists
                ? CSVFormat.DEFAULT
                : CSVFormat.DEFAULT.builder().setHeader(LayoffColumns.ALL.toArray(new String[0])).build();
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
             CSVPrinter printer = new CSVPrinter(out, format)) {
            for (Record<LayoffRecord> r : records) {
                LayoffRecord l = r.payload();
                printer.printRecord(l.company(), l.location(), l.industry(), l.totalLaidOff(), l.percentageLaidOff(),
                        l.date(), l.stage(), l.country(), l.fundsRaised() == null ? null : l.fundsRaised().toPlainString());
            }
        }
    }

    public Path file() { return file; }
}
