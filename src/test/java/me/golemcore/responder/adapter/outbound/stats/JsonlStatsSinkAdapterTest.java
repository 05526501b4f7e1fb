package me.golemcore.responder.adapter.outbound.stats;

import me.golemcore.responder.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.responder.domain.exception.SinkUnavailableException;
import me.golemcore.responder.domain.model.DecisionReason;
import me.golemcore.responder.domain.model.FeedbackEvent;
import me.golemcore.responder.domain.model.StatRecord;
import me.golemcore.responder.infrastructure.config.AutoConfiguration;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import me.golemcore.responder.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JsonlStatsSinkAdapterTest {

    private static final Instant DAY_ONE = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant DAY_TWO = Instant.parse("2026-03-02T08:30:00Z");

    @TempDir
    Path tempDir;

    private ResponderProperties properties;
    private ObjectMapper objectMapper;
    private JsonlStatsSinkAdapter sink;

    @BeforeEach
    void setUp() {
        properties = new ResponderProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        sink = new JsonlStatsSinkAdapter(storage, objectMapper, properties);
    }

    private static StatRecord statRecord(String id, Instant at) {
        return StatRecord.builder()
                .id(id)
                .patternId("greeting_hello")
                .userId("u1")
                .timestamp(at)
                .sent(true)
                .reason(DecisionReason.PATTERN_MATCHED)
                .messageContent("hello")
                .responseContent("👋 Hello there!")
                .build();
    }

    // ===== Append =====

    @Test
    void recordsAreWrittenToDailyFiles() {
        sink.append(statRecord("r1", DAY_ONE));
        sink.append(statRecord("r2", DAY_TWO));

        assertTrue(Files.exists(tempDir.resolve("stats/2026-03-01.jsonl")));
        assertTrue(Files.exists(tempDir.resolve("stats/2026-03-02.jsonl")));
    }

    @Test
    void feedbackIsWrittenUnderFeedbackDirectory() {
        sink.appendFeedback(FeedbackEvent.builder().recordId("r1").accepted(true).timestamp(DAY_ONE).build());

        assertTrue(Files.exists(tempDir.resolve("stats/feedback/2026-03-01.jsonl")));
    }

    // ===== Load =====

    @Test
    void loadSinceReturnsRecordsWithFeedbackApplied() {
        sink.append(statRecord("r1", DAY_ONE));
        sink.append(statRecord("r2", DAY_TWO));
        sink.appendFeedback(FeedbackEvent.builder()
                .recordId("r1").accepted(false).note("too generic").timestamp(DAY_TWO).build());

        List<StatRecord> loaded = sink.loadSince(DAY_ONE.minus(Duration.ofHours(1)));

        assertEquals(2, loaded.size());
        StatRecord first = loaded.stream().filter(r -> "r1".equals(r.getId())).findFirst().orElseThrow();
        assertEquals(Boolean.FALSE, first.getUserAccepted());
        assertEquals("too generic", first.getFeedback());
        assertEquals(DAY_TWO, first.getFeedbackAt());
        assertEquals(DecisionReason.PATTERN_MATCHED, first.getReason());
        assertEquals("👋 Hello there!", first.getResponseContent());
    }

    @Test
    void onlyFirstFeedbackEventIsApplied() {
        sink.append(statRecord("r1", DAY_ONE));
        sink.appendFeedback(FeedbackEvent.builder().recordId("r1").accepted(true).timestamp(DAY_ONE).build());
        sink.appendFeedback(FeedbackEvent.builder().recordId("r1").accepted(false).timestamp(DAY_TWO).build());

        StatRecord loaded = sink.loadSince(DAY_ONE.minusSeconds(60)).get(0);

        assertEquals(Boolean.TRUE, loaded.getUserAccepted());
    }

    @Test
    void loadSinceSkipsOlderDaysAndOlderRecords() {
        sink.append(statRecord("old", Instant.parse("2026-02-20T12:00:00Z")));
        sink.append(statRecord("early", DAY_TWO.minus(Duration.ofHours(2))));
        sink.append(statRecord("late", DAY_TWO));

        List<StatRecord> loaded = sink.loadSince(DAY_TWO.minus(Duration.ofHours(1)));

        assertEquals(List.of("late"), loaded.stream().map(StatRecord::getId).toList());
    }

    @Test
    void malformedLinesAreSkipped() throws IOException {
        sink.append(statRecord("r1", DAY_ONE));
        Files.writeString(tempDir.resolve("stats/2026-03-01.jsonl"), "{broken\n",
                StandardOpenOption.APPEND);
        sink.append(statRecord("r2", DAY_ONE.plusSeconds(5)));

        List<StatRecord> loaded = sink.loadSince(DAY_ONE.minusSeconds(60));

        assertEquals(List.of("r1", "r2"), loaded.stream().map(StatRecord::getId).toList());
    }

    @Test
    void unrelatedFilesAreIgnored() throws IOException {
        sink.append(statRecord("r1", DAY_ONE));
        Files.writeString(tempDir.resolve("stats/notes.jsonl"), "{\"id\":\"x\"}\n");
        Files.writeString(tempDir.resolve("stats/readme.txt"), "hello\n");

        assertEquals(1, sink.loadSince(DAY_ONE.minusSeconds(60)).size());
    }

    @Test
    void emptySinkLoadsNothing() {
        assertTrue(sink.loadSince(DAY_ONE).isEmpty());
    }

    // ===== Failures =====

    @Test
    void storageFailureBecomesSinkUnavailable() {
        StoragePort broken = mock(StoragePort.class);
        when(broken.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));
        JsonlStatsSinkAdapter brokenSink = new JsonlStatsSinkAdapter(broken, objectMapper, properties);

        SinkUnavailableException ex = assertThrows(SinkUnavailableException.class,
                () -> brokenSink.append(statRecord("r1", DAY_ONE)));
        assertTrue(ex.getMessage().contains("disk full"));
    }

    @Test
    void slowStorageTimesOut() {
        properties.getStats().setSinkTimeout(Duration.ofMillis(50));
        StoragePort stuck = mock(StoragePort.class);
        when(stuck.appendText(anyString(), anyString(), anyString())).thenReturn(new CompletableFuture<>());
        JsonlStatsSinkAdapter stuckSink = new JsonlStatsSinkAdapter(stuck, objectMapper, properties);

        assertThrows(SinkUnavailableException.class, () -> stuckSink.append(statRecord("r1", DAY_ONE)));
    }
}
