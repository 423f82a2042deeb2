package com.conversionlog.sdk.attemptlog;

import com.conversionlog.sdk.model.AttemptLogEntry;
import com.conversionlog.sdk.model.ConversionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesAttemptLogStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private static AttemptLogEntry entry(String bookingId, ConversionType type, boolean success, Instant at) {
        return AttemptLogEntry.builder()
                .bookingId(bookingId)
                .conversionType(type)
                .success(success)
                .timestamp(at)
                .detail("attempt", 1)
                .build();
    }

    @Test
    void appendedEntriesSurviveReopen() {
        Path file = tempDir.resolve("logs").resolve(JsonLinesAttemptLogStore.DEFAULT_FILE_NAME);
        JsonLinesAttemptLogStore store = new JsonLinesAttemptLogStore(file);
        AttemptLogEntry first = entry("B1", ConversionType.CLIENT, false, T0);
        AttemptLogEntry second = entry("B1", ConversionType.SERVER, true, T0.plusSeconds(30));
        store.append(first);
        store.append(second);

        JsonLinesAttemptLogStore reopened = new JsonLinesAttemptLogStore(file);

        assertEquals(2, reopened.size());
        List<AttemptLogEntry> entries = reopened.findByBookingId("B1");
        assertEquals(second, entries.get(0));
        assertEquals(first, entries.get(1));
        assertEquals(ConversionType.SERVER, entries.get(0).getConversionType());
        assertTrue(entries.get(0).isSuccess());
        assertEquals(T0.plusSeconds(30), entries.get(0).getTimestamp());
        assertEquals(1, entries.get(0).getDetails().get("attempt"));
    }

    @Test
    void entriesAreWrittenWithSnakeCaseFields() throws Exception {
        Path file = tempDir.resolve("attempts.jsonl");
        new JsonLinesAttemptLogStore(file).append(entry("B7", ConversionType.CLIENT, true, T0));

        String line = Files.readAllLines(file, StandardCharsets.UTF_8).get(0);
        assertTrue(line.contains("\"booking_id\":\"B7\""));
        assertTrue(line.contains("\"conversion_type\":\"client\""));
        assertTrue(line.contains("\"created_at\":\"2024-05-01T00:00:00Z\""));
    }

    @Test
    void corruptLinesAreSkippedOnLoad() throws Exception {
        Path file = tempDir.resolve("attempts.jsonl");
        new JsonLinesAttemptLogStore(file).append(entry("B1", ConversionType.CLIENT, true, T0));
        Files.writeString(file, "{not json\n\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        JsonLinesAttemptLogStore reopened = new JsonLinesAttemptLogStore(file);

        assertEquals(1, reopened.size());
    }

    @Test
    void findBetweenIsInclusiveAndOrdered() {
        JsonLinesAttemptLogStore store = new JsonLinesAttemptLogStore(tempDir.resolve("a.jsonl"));
        store.append(entry("B3", ConversionType.CLIENT, true, T0.plusSeconds(120)));
        store.append(entry("B1", ConversionType.CLIENT, true, T0));
        store.append(entry("B2", ConversionType.SERVER, true, T0.plusSeconds(60)));
        store.append(entry("B4", ConversionType.SERVER, true, T0.plusSeconds(121)));

        List<AttemptLogEntry> found = store.findBetween(T0, T0.plusSeconds(120));

        assertEquals(3, found.size());
        assertEquals("B1", found.get(0).getBookingId());
        assertEquals("B2", found.get(1).getBookingId());
        assertEquals("B3", found.get(2).getBookingId());
    }

    @Test
    void purgeRewritesFile() {
        Path file = tempDir.resolve("a.jsonl");
        JsonLinesAttemptLogStore store = new JsonLinesAttemptLogStore(file);
        store.append(entry("OLD", ConversionType.CLIENT, true, T0));
        store.append(entry("NEW", ConversionType.CLIENT, true, T0.plusSeconds(3600)));

        assertEquals(1, store.purgeOlderThan(T0.plusSeconds(1)));
        assertEquals(0, store.purgeOlderThan(T0.plusSeconds(1)));

        JsonLinesAttemptLogStore reopened = new JsonLinesAttemptLogStore(file);
        assertEquals(1, reopened.size());
        assertTrue(reopened.findByBookingId("OLD").isEmpty());
        assertFalse(Files.exists(tempDir.resolve("a.jsonl.tmp")));
    }
}
