package me.golemcore.responder.stats;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.responder.domain.exception.ResponderException;
import me.golemcore.responder.domain.model.AcceptanceStats;
import me.golemcore.responder.domain.model.FeedbackEvent;
import me.golemcore.responder.domain.model.ResponderFailureKind;
import me.golemcore.responder.domain.model.StatRecord;
import me.golemcore.responder.domain.model.StatsSummary;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import me.golemcore.responder.port.outbound.StatsSinkPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link StatsRecorder} that decouples persistence
 * from the response path.
 *
 * <p>
 * Features:
 * <ul>
 * <li>In-memory index of records for aggregation, with concurrent access
 * support</li>
 * <li>Bounded queue of pending writes drained by a background thread into the
 * {@link StatsSinkPort}; when the queue is full the write is dropped and
 * counted, the caller never blocks</li>
 * <li>Sink failures are logged and counted, never propagated</li>
 * <li>Loads persisted records on startup (within retention) and evicts old
 * ones hourly</li>
 * </ul>
 *
 * <p>
 * Can be disabled via {@code responder.stats.enabled=false}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class AsyncStatsRecorder implements StatsRecorder {

    private static final String LOG_PREFIX = "[Stats]";
    private static final String ALL_PATTERNS = "all";
    private static final String NO_PATTERN = "none";
    private static final int EVICTION_INTERVAL_HOURS = 1;
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final StatsSinkPort statsSink;
    private final ResponderProperties properties;
    private final Clock clock;

    private final Map<String, StatRecord> records = new ConcurrentHashMap<>();
    private final BlockingQueue<Object> pendingWrites;
    private final AtomicLong droppedRecords = new AtomicLong();
    private final AtomicLong sinkFailures = new AtomicLong();

    private ScheduledExecutorService writerExecutor;

    public AsyncStatsRecorder(StatsSinkPort statsSink, ResponderProperties properties, Clock clock) {
        this.statsSink = statsSink;
        this.properties = properties;
        this.clock = clock;
        this.pendingWrites = new ArrayBlockingQueue<>(Math.max(1, properties.getStats().getQueueCapacity()));
    }

    @PostConstruct
    public void init() {
        loadPersistedRecords();
        long flushMs = properties.getStats().getFlushInterval().toMillis();
        writerExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stats-writer");
            t.setDaemon(true);
            return t;
        });
        writerExecutor.scheduleWithFixedDelay(this::drainPending, flushMs, flushMs, TimeUnit.MILLISECONDS);
        writerExecutor.scheduleAtFixedRate(this::evictOldRecords,
                EVICTION_INTERVAL_HOURS, EVICTION_INTERVAL_HOURS, TimeUnit.HOURS);
    }

    @PreDestroy
    public void destroy() {
        if (writerExecutor != null) {
            writerExecutor.shutdownNow();
            try {
                writerExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int flushed = drainPending();
        if (flushed > 0) {
            log.info("{} Flushed {} pending writes on shutdown", LOG_PREFIX, flushed);
        }
    }

    @Override
    public String record(StatRecord outcome) {
        if (!properties.getStats().isEnabled() || outcome == null) {
            return null;
        }
        int maxLength = properties.getStats().getContentMaxLength();
        StatRecord stored = StatRecord.builder()
                .id(outcome.getId() != null ? outcome.getId() : UUID.randomUUID().toString())
                .patternId(outcome.getPatternId())
                .userId(outcome.getUserId())
                .timestamp(outcome.getTimestamp() != null ? outcome.getTimestamp() : clock.instant())
                .sent(outcome.isSent())
                .reason(outcome.getReason())
                .userAccepted(outcome.getUserAccepted())
                .feedback(outcome.getFeedback())
                .feedbackAt(outcome.getFeedbackAt())
                .messageContent(truncate(outcome.getMessageContent(), maxLength))
                .responseContent(truncate(outcome.getResponseContent(), maxLength))
                .build();

        if (records.putIfAbsent(stored.getId(), stored) != null) {
            throw new ResponderException(ResponderFailureKind.VALIDATION,
                    "Stat record " + stored.getId() + " already exists");
        }
        enqueue(copy(stored));

        log.debug("{} Recorded outcome: pattern={}, user={}, sent={}", LOG_PREFIX,
                stored.getPatternId(), stored.getUserId(), stored.isSent());
        return stored.getId();
    }

    @Override
    public StatRecord attachFeedback(String recordId, boolean accepted, String note) {
        StatRecord stored = recordId == null ? null : records.get(recordId);
        if (stored == null) {
            throw new ResponderException(ResponderFailureKind.NOT_FOUND, "Unknown stat record: " + recordId);
        }
        FeedbackEvent event;
        StatRecord snapshot;
        synchronized (stored) {
            if (stored.hasFeedback()) {
                throw new ResponderException(ResponderFailureKind.VALIDATION,
                        "Feedback already attached to stat record " + recordId);
            }
            Instant now = clock.instant();
            stored.setUserAccepted(accepted);
            stored.setFeedback(truncate(note, properties.getStats().getContentMaxLength()));
            stored.setFeedbackAt(now);
            event = FeedbackEvent.builder()
                    .recordId(recordId)
                    .accepted(accepted)
                    .note(stored.getFeedback())
                    .timestamp(now)
                    .build();
            snapshot = copy(stored);
        }
        enqueue(event);
        log.debug("{} Feedback attached to {}: accepted={}", LOG_PREFIX, recordId, accepted);
        return snapshot;
    }

    @Override
    public Optional<StatRecord> find(String recordId) {
        if (recordId == null) {
            return Optional.empty();
        }
        StatRecord stored = records.get(recordId);
        if (stored == null) {
            return Optional.empty();
        }
        synchronized (stored) {
            return Optional.of(copy(stored));
        }
    }

    @Override
    public OptionalDouble acceptanceRate(String patternId, Duration window) {
        return patternStats(patternId, window).rate();
    }

    @Override
    public AcceptanceStats patternStats(String patternId, Duration window) {
        List<StatRecord> inWindow = recordsWithin(window).stream()
                .filter(r -> patternId != null && patternId.equals(r.getPatternId()))
                .toList();
        return aggregate(patternId, inWindow);
    }

    @Override
    public StatsSummary summary(Duration window) {
        List<StatRecord> inWindow = recordsWithin(window);
        Map<String, List<StatRecord>> grouped = inWindow.stream()
                .collect(Collectors.groupingBy(r -> r.getPatternId() != null ? r.getPatternId() : NO_PATTERN,
                        LinkedHashMap::new, Collectors.toList()));
        Map<String, AcceptanceStats> byPattern = new LinkedHashMap<>();
        for (Map.Entry<String, List<StatRecord>> entry : grouped.entrySet()) {
            byPattern.put(entry.getKey(), aggregate(entry.getKey(), entry.getValue()));
        }
        return StatsSummary.builder()
                .window(window)
                .overall(aggregate(ALL_PATTERNS, inWindow))
                .byPattern(byPattern)
                .droppedRecords(droppedRecords.get())
                .sinkFailures(sinkFailures.get())
                .build();
    }

    /**
     * Write every queued record and feedback event to the sink.
     *
     * @return number of entries taken from the queue
     */
    int drainPending() {
        int drained = 0;
        Object next;
        while ((next = pendingWrites.poll()) != null) {
            drained++;
            try {
                if (next instanceof StatRecord statRecord) {
                    statsSink.append(statRecord);
                } else if (next instanceof FeedbackEvent feedback) {
                    statsSink.appendFeedback(feedback);
                }
            } catch (RuntimeException e) {
                sinkFailures.incrementAndGet();
                log.warn("{} Failed to write to stats sink, entry dropped: {}", LOG_PREFIX, e.getMessage());
            }
        }
        return drained;
    }

    long getDroppedRecords() {
        return droppedRecords.get();
    }

    long getSinkFailures() {
        return sinkFailures.get();
    }

    private void enqueue(Object entry) {
        if (!pendingWrites.offer(entry)) {
            long dropped = droppedRecords.incrementAndGet();
            log.warn("{} Write queue full, dropping entry (dropped so far: {})", LOG_PREFIX, dropped);
        }
    }

    private void loadPersistedRecords() {
        if (!properties.getStats().isEnabled()) {
            return;
        }
        Instant cutoff = clock.instant().minus(properties.getStats().getRetention());
        try {
            List<StatRecord> persisted = statsSink.loadSince(cutoff);
            int loaded = 0;
            for (StatRecord persistedRecord : persisted) {
                if (persistedRecord == null || persistedRecord.getId() == null) {
                    continue;
                }
                records.putIfAbsent(persistedRecord.getId(), persistedRecord);
                loaded++;
            }
            log.info("{} Loaded {} stat records from sink", LOG_PREFIX, loaded);
        } catch (RuntimeException e) {
            log.warn("{} Failed to load persisted stat records", LOG_PREFIX, e);
        }
    }

    void evictOldRecords() {
        Instant cutoff = clock.instant().minus(properties.getStats().getRetention());
        int before = records.size();
        records.values().removeIf(r -> r.getTimestamp() != null && r.getTimestamp().isBefore(cutoff));
        int evicted = before - records.size();
        if (evicted > 0) {
            log.debug("{} Evicted {} records beyond {}d retention", LOG_PREFIX, evicted,
                    properties.getStats().getRetention().toDays());
        }
    }

    private List<StatRecord> recordsWithin(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<StatRecord> result = new ArrayList<>();
        for (StatRecord stored : records.values()) {
            synchronized (stored) {
                if (stored.getTimestamp() != null && stored.getTimestamp().isAfter(cutoff)) {
                    result.add(copy(stored));
                }
            }
        }
        return result;
    }

    private AcceptanceStats aggregate(String key, List<StatRecord> statRecords) {
        if (statRecords.isEmpty()) {
            return AcceptanceStats.empty(key);
        }
        long sent = statRecords.stream().filter(StatRecord::isSent).count();
        long accepted = statRecords.stream().filter(r -> Boolean.TRUE.equals(r.getUserAccepted())).count();
        long rejected = statRecords.stream().filter(r -> Boolean.FALSE.equals(r.getUserAccepted())).count();
        long withFeedback = accepted + rejected;
        return AcceptanceStats.builder()
                .key(key)
                .total(statRecords.size())
                .sent(sent)
                .accepted(accepted)
                .rejected(rejected)
                .pending(statRecords.size() - withFeedback)
                .acceptanceRate(withFeedback == 0 ? null : (double) accepted / withFeedback)
                .build();
    }

    private static StatRecord copy(StatRecord source) {
        return StatRecord.builder()
                .id(source.getId())
                .patternId(source.getPatternId())
                .userId(source.getUserId())
                .timestamp(source.getTimestamp())
                .sent(source.isSent())
                .reason(source.getReason())
                .userAccepted(source.getUserAccepted())
                .feedback(source.getFeedback())
                .feedbackAt(source.getFeedbackAt())
                .messageContent(source.getMessageContent())
                .responseContent(source.getResponseContent())
                .build();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
