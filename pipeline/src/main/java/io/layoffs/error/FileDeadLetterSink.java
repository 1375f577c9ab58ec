package io.layoffs.error;

import io.layoffs.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Appends one JSON line per failed record.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;
    private final Clock clock;

    public FileDeadLetterSink(Path file) throws IOException {
        this(file, Clock.systemUTC());
    }

    public FileDeadLetterSink(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, Exception e) {
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"seq\":%d,\"subSeq\":%d,\"error\":\"%s\"}%n",
                clock.instant(), safe(stage), record == null ? -1 : record.seq(), record == null ? -1 : record.subSeq(),
                safe(e.toString())
        );
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            log.warn("could not write dead letter for stage={} seq={} to {}", stage,
                    record == null ? -1 : record.seq(), file, io);
        }
    }

    public Path file() { return file; }

    private static String safe(String s) { return s.replace("\\", "\\\\").replace("\"", "'"); }
}
