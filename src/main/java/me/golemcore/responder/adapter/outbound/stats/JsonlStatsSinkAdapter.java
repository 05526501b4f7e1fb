package me.golemcore.responder.adapter.outbound.stats;

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

import me.golemcore.responder.domain.exception.SinkUnavailableException;
import me.golemcore.responder.domain.model.FeedbackEvent;
import me.golemcore.responder.domain.model.StatRecord;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import me.golemcore.responder.port.outbound.StatsSinkPort;
import me.golemcore.responder.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Append-only JSONL sink on top of {@link StoragePort}.
 *
 * <p>
 * Layout under {@code stats/}:
 * <ul>
 * <li>{@code <yyyy-MM-dd>.jsonl} - one {@link StatRecord} per line, by record
 * day (UTC)</li>
 * <li>{@code feedback/<yyyy-MM-dd>.jsonl} - one {@link FeedbackEvent} per
 * line</li>
 * </ul>
 * Feedback is applied to records when they are loaded back; records are never
 * rewritten.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlStatsSinkAdapter implements StatsSinkPort {

    static final String STATS_DIR = "stats";
    static final String FEEDBACK_PREFIX = "feedback/";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final String LOG_PREFIX = "[StatsSink]";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ResponderProperties properties;

    @Override
    public void append(StatRecord statRecord) {
        appendLine(dayFile(statRecord.getTimestamp()), statRecord);
    }

    @Override
    public void appendFeedback(FeedbackEvent feedback) {
        appendLine(FEEDBACK_PREFIX + dayFile(feedback.getTimestamp()), feedback);
    }

    @Override
    public List<StatRecord> loadSince(Instant since) {
        LocalDate firstDay = LocalDate.ofInstant(since, ZoneOffset.UTC);
        List<String> files = await(storagePort.listObjects(STATS_DIR, ""), "list stats files");

        Map<String, StatRecord> records = new LinkedHashMap<>();
        List<FeedbackEvent> feedback = new ArrayList<>();
        for (String file : files) {
            boolean feedbackFile = file.startsWith(FEEDBACK_PREFIX);
            String name = feedbackFile ? file.substring(FEEDBACK_PREFIX.length()) : file;
            if (!name.endsWith(JSONL_EXTENSION) || name.contains("/") || isBefore(name, firstDay)) {
                continue;
            }
            String content = await(storagePort.getText(STATS_DIR, file), "read " + file);
            if (content == null || content.isBlank()) {
                continue;
            }
            if (feedbackFile) {
                feedback.addAll(parseLines(file, content, FeedbackEvent.class));
            } else {
                for (StatRecord statRecord : parseLines(file, content, StatRecord.class)) {
                    if (statRecord.getId() != null && statRecord.getTimestamp() != null
                            && !statRecord.getTimestamp().isBefore(since)) {
                        records.putIfAbsent(statRecord.getId(), statRecord);
                    }
                }
            }
        }

        for (FeedbackEvent event : feedback) {
            StatRecord statRecord = records.get(event.getRecordId());
            if (statRecord == null || statRecord.hasFeedback()) {
                continue;
            }
            statRecord.setUserAccepted(event.isAccepted());
            statRecord.setFeedback(event.getNote());
            statRecord.setFeedbackAt(event.getTimestamp());
        }
        log.debug("{} Loaded {} records and {} feedback events since {}", LOG_PREFIX, records.size(),
                feedback.size(), since);
        return new ArrayList<>(records.values());
    }

    private void appendLine(String file, Object entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry) + NEWLINE;
        } catch (JsonProcessingException e) {
            throw new SinkUnavailableException("Failed to serialize stats entry", e);
        }
        await(storagePort.appendText(STATS_DIR, file, json), "append to " + file);
    }

    private <T> T await(CompletableFuture<T> future, String action) {
        long timeoutMs = properties.getStats().getSinkTimeout().toMillis();
        try {
            return future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SinkUnavailableException("Stats sink failed to " + action + ": " + cause.getMessage(), cause);
        }
    }

    private <T> List<T> parseLines(String file, String content, Class<T> type) {
        List<T> entries = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        return entries;
    }

    private static boolean isBefore(String fileName, LocalDate firstDay) {
        String day = fileName.substring(0, fileName.length() - JSONL_EXTENSION.length());
        try {
            return LocalDate.parse(day).isBefore(firstDay);
        } catch (DateTimeParseException e) {
            return true;
        }
    }

    private static String dayFile(Instant timestamp) {
        Instant at = timestamp != null ? timestamp : Instant.now();
        return LocalDate.ofInstant(at, ZoneOffset.UTC) + JSONL_EXTENSION;
    }
}
