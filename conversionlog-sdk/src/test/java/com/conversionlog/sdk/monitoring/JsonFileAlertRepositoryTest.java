package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.model.Alert;
import com.conversionlog.sdk.model.AlertSeverity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileAlertRepositoryTest {

    @TempDir
    Path tempDir;

    private static Alert alert(String id) {
        return new Alert(id, "tracking_error", AlertSeverity.HIGH, "boom",
                Instant.parse("2024-05-01T00:00:00Z"), Map.of("booking_id", "B1"));
    }

    @Test
    void missingFileLoadsEmpty() {
        JsonFileAlertRepository repository = new JsonFileAlertRepository(tempDir.resolve("none.json"));
        assertTrue(repository.load().history().isEmpty());
    }

    @Test
    void savedSnapshotIsReadBack() {
        Path file = tempDir.resolve("nested").resolve(JsonFileAlertRepository.DEFAULT_FILE_NAME);
        new JsonFileAlertRepository(file).save(new AlertRepository.Snapshot(
                List.of(alert("a2")), List.of(alert("a1"), alert("a2"))));

        AlertRepository.Snapshot loaded = new JsonFileAlertRepository(file).load();

        assertEquals(1, loaded.active().size());
        assertEquals(2, loaded.history().size());
        assertEquals("a1", loaded.history().get(0).getId());
        assertEquals("B1", loaded.history().get(0).getData().get("booking_id"));
        assertFalse(Files.exists(file.resolveSibling(file.getFileName() + ".tmp")));
    }

    @Test
    void unreadableFileLoadsEmpty() throws Exception {
        Path file = tempDir.resolve("alerts.json");
        Files.writeString(file, "[not an object");

        assertTrue(new JsonFileAlertRepository(file).load().active().isEmpty());
    }

    @Test
    void alertServiceSurvivesRestartThroughFile() {
        Path file = tempDir.resolve("alerts.json");
        AlertService first = AlertService.builder().repository(new JsonFileAlertRepository(file)).build();
        Alert raised = first.handleAlert("tracking_error", AlertSeverity.HIGH, "boom", Map.of("attempt", 3));

        AlertService second = AlertService.builder().repository(new JsonFileAlertRepository(file)).build();

        assertEquals(raised.getId(), second.getAlertHistory().get(0).getId());
        assertEquals(3, second.getAlertHistory().get(0).getData().get("attempt"));
    }
}
