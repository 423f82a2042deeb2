package com.conversionlog.sdk.attemptlog;

import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.model.AttemptLogEntry;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Durable attempt log backed by a JSON-lines file, one entry per line.
 *
 * <p>The file is read once at construction; corrupt lines are skipped with a warning. Appends
 * go to the end of the file and to an in-memory copy under one lock. Purging rewrites the file
 * through a temp file and an atomic move.</p>
 */
public class JsonLinesAttemptLogStore implements AttemptLogStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesAttemptLogStore.class);

    public static final String DEFAULT_FILE_NAME = "conversion-attempts.jsonl";

    private final Path file;
    private final ObjectMapper objectMapper;
    private final List<AttemptLogEntry> entries = new ArrayList<>();
    private final Object lock = new Object();

    public JsonLinesAttemptLogStore(Path file) {
        this(file, ConversionLogUtils.defaultObjectMapper());
    }

    public JsonLinesAttemptLogStore(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ConversionLogException("Failed to create attempt log directory for " + file, e);
        }
        load();
    }

    // ========================================================================
    // AttemptLogStore
    // ========================================================================

    @Override
    public void append(AttemptLogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        try {
            byte[] payload = (objectMapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
            synchronized (lock) {
                Files.write(file, payload, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                entries.add(entry);
            }
        } catch (IOException e) {
            throw new ConversionLogException("Failed to append attempt log entry for booking "
                    + entry.getBookingId(), e);
        }
    }

    @Override
    public List<AttemptLogEntry> findByBookingId(String bookingId) {
        synchronized (lock) {
            return entries.stream()
                    .filter(entry -> entry.getBookingId().equals(bookingId))
                    .sorted(Comparator.comparing(AttemptLogEntry::getTimestamp).reversed())
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<AttemptLogEntry> findBetween(Instant start, Instant end) {
        synchronized (lock) {
            return entries.stream()
                    .filter(entry -> !entry.getTimestamp().isBefore(start) && !entry.getTimestamp().isAfter(end))
                    .sorted(Comparator.comparing(AttemptLogEntry::getTimestamp))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        synchronized (lock) {
            List<AttemptLogEntry> retained = entries.stream()
                    .filter(entry -> !entry.getTimestamp().isBefore(cutoff))
                    .collect(Collectors.toList());
            int removed = entries.size() - retained.size();
            if (removed == 0) {
                return 0;
            }
            try {
                rewrite(retained);
            } catch (IOException e) {
                throw new ConversionLogException("Failed to purge attempt log " + file, e);
            }
            entries.clear();
            entries.addAll(retained);
            log.info("Purged {} attempt log entries older than {}", removed, cutoff);
            return removed;
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public Path getFile() {
        return file;
    }

    // ========================================================================
    // Internal - file handling
    // ========================================================================

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConversionLogException("Failed to read attempt log " + file, e);
        }
        int skipped = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, AttemptLogEntry.class));
            } catch (IOException e) {
                skipped++;
                log.warn("Skipping corrupt attempt log line: {}", e.getMessage());
            }
        }
        log.info("Loaded {} attempt log entries from {} ({} skipped)", entries.size(), file, skipped);
    }

    private void rewrite(List<AttemptLogEntry> retained) throws IOException {
        Path tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        StringBuilder payload = new StringBuilder();
        for (AttemptLogEntry entry : retained) {
            payload.append(objectMapper.writeValueAsString(entry)).append('\n');
        }
        Files.writeString(tempFile, payload, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }
}
