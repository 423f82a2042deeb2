package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.model.Alert;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Stores the alert snapshot as a single JSON document, replaced atomically on every save.
 */
public class JsonFileAlertRepository implements AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileAlertRepository.class);

    public static final String DEFAULT_FILE_NAME = "conversion-alerts.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileAlertRepository(Path file) {
        this(file, ConversionLogUtils.defaultObjectMapper());
    }

    public JsonFileAlertRepository(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public Snapshot load() {
        if (!Files.exists(file)) {
            return Snapshot.empty();
        }
        try {
            StoredAlerts stored = objectMapper.readValue(file.toFile(), StoredAlerts.class);
            Snapshot snapshot = new Snapshot(stored.active, stored.history);
            log.info("Loaded {} active and {} historical alerts from {}",
                    snapshot.active().size(), snapshot.history().size(), file);
            return snapshot;
        } catch (IOException e) {
            log.warn("Alert file {} is unreadable, starting empty: {}", file, e.getMessage());
            return Snapshot.empty();
        }
    }

    @Override
    public synchronized void save(Snapshot snapshot) {
        StoredAlerts stored = new StoredAlerts();
        stored.active = snapshot.active();
        stored.history = snapshot.history();
        Path tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tempFile.toFile(), stored);
            try {
                Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new ConversionLogException("Failed to save alerts to " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    static class StoredAlerts {
        @JsonProperty("active")
        public List<Alert> active;

        @JsonProperty("history")
        public List<Alert> history;
    }
}
