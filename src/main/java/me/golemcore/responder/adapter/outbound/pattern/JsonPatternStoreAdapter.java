package me.golemcore.responder.adapter.outbound.pattern;

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

import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.port.outbound.PatternStorePort;
import me.golemcore.responder.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores all patterns in a single JSON document,
 * {@code patterns/patterns.json}, rewritten atomically with a backup on every
 * change.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonPatternStoreAdapter implements PatternStorePort {

    static final String PATTERNS_DIR = "patterns";
    static final String PATTERNS_FILE = "patterns.json";
    private static final int DOCUMENT_VERSION = 1;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Object lock = new Object();

    @Override
    public List<ResponsePattern> loadAll() {
        synchronized (lock) {
            return new ArrayList<>(readLocked().values());
        }
    }

    @Override
    public void save(ResponsePattern pattern) {
        synchronized (lock) {
            Map<String, ResponsePattern> patterns = readLocked();
            patterns.put(pattern.getId(), pattern);
            writeLocked(patterns.values());
        }
    }

    @Override
    public void saveAll(Collection<ResponsePattern> patterns) {
        synchronized (lock) {
            writeLocked(patterns);
        }
    }

    @Override
    public boolean delete(String patternId) {
        synchronized (lock) {
            Map<String, ResponsePattern> patterns = readLocked();
            if (patterns.remove(patternId) == null) {
                return false;
            }
            writeLocked(patterns.values());
            return true;
        }
    }

    private Map<String, ResponsePattern> readLocked() {
        String json = storagePort.getText(PATTERNS_DIR, PATTERNS_FILE).join();
        Map<String, ResponsePattern> patterns = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return patterns;
        }
        try {
            PatternDocument document = objectMapper.readValue(json, PatternDocument.class);
            if (document.getPatterns() != null) {
                for (ResponsePattern pattern : document.getPatterns()) {
                    if (pattern != null && pattern.getId() != null) {
                        patterns.put(pattern.getId(), pattern);
                    }
                }
            }
            return patterns;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed pattern store " + PATTERNS_DIR + "/" + PATTERNS_FILE, e);
        }
    }

    private void writeLocked(Collection<ResponsePattern> patterns) {
        PatternDocument document = new PatternDocument();
        document.setVersion(DOCUMENT_VERSION);
        document.setUpdatedAt(clock.instant().toString());
        document.setPatterns(new ArrayList<>(patterns));
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
            storagePort.putTextAtomic(PATTERNS_DIR, PATTERNS_FILE, json, true).join();
            log.debug("[PatternStore] Wrote {} patterns", patterns.size());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize patterns", e);
        }
    }

    @Data
    @NoArgsConstructor
    static class PatternDocument {
        private int version;
        private String updatedAt;
        private List<ResponsePattern> patterns = new ArrayList<>();
    }
}
