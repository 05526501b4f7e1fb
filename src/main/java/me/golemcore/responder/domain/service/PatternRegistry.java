package me.golemcore.responder.domain.service;

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

import me.golemcore.responder.domain.exception.PatternValidationException;
import me.golemcore.responder.domain.model.ActivePatternSet;
import me.golemcore.responder.domain.model.CompiledPattern;
import me.golemcore.responder.domain.model.PatternSummary;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import me.golemcore.responder.port.outbound.PatternStorePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Holds the current {@link ActivePatternSet} behind an atomically swapped
 * reference.
 *
 * <p>
 * Readers call {@link #currentSnapshot()} without locking and always see a
 * complete set. Writers (upsert, remove, disable, load, reload) build a new
 * snapshot from the current one and swap it in; writers are serialized among
 * themselves so that concurrent edits are not lost.
 *
 * <p>
 * Validation happens before any swap: an invalid pattern, or a load containing
 * one, leaves the registry unchanged.
 *
 * <p>
 * Store failures on write are logged and do not roll back the in-memory
 * change; {@link #sync(boolean)} can be used to push the active set again.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PatternRegistry {

    private static final String LOG_PREFIX = "[Registry]";

    private final PatternStorePort patternStore;
    private final PatternValidator validator;
    private final ResponderProperties properties;
    private final Clock clock;

    private final AtomicReference<ActivePatternSet> current = new AtomicReference<>(ActivePatternSet.empty());
    private final AtomicLong versionSequence = new AtomicLong();
    private final Object writeLock = new Object();

    @PostConstruct
    public void init() {
        try {
            reload();
        } catch (RuntimeException e) {
            log.warn("{} Initial pattern load failed, starting with an empty registry: {}",
                    LOG_PREFIX, e.getMessage());
        }
    }

    public ActivePatternSet currentSnapshot() {
        return current.get();
    }

    /**
     * Replace the whole registry with the given patterns.
     *
     * @throws PatternValidationException
     *             if any pattern is invalid; the registry is left unchanged
     */
    public ActivePatternSet load(Collection<ResponsePattern> patterns) {
        Map<String, CompiledPattern> compiled = new LinkedHashMap<>();
        for (ResponsePattern pattern : patterns) {
            CompiledPattern compiledPattern = validator.compile(pattern);
            if (compiled.put(compiledPattern.getId(), compiledPattern) != null) {
                log.warn("{} Duplicate pattern id '{}' in load, keeping the last definition",
                        LOG_PREFIX, compiledPattern.getId());
            }
        }
        synchronized (writeLock) {
            ActivePatternSet snapshot = newSnapshot(compiled.values());
            current.set(snapshot);
            log.info("{} Loaded {} patterns (version {})", LOG_PREFIX, snapshot.size(), snapshot.getVersion());
            return snapshot;
        }
    }

    /**
     * Load patterns from the persistent store. An empty store is seeded with
     * {@link BuiltinPatterns} when {@code responder.patterns.load-builtin} is
     * set.
     */
    public ActivePatternSet reload() {
        List<ResponsePattern> stored = patternStore.loadAll();
        if ((stored == null || stored.isEmpty()) && properties.getPatterns().isLoadBuiltin()) {
            List<ResponsePattern> builtin = BuiltinPatterns.defaults();
            log.info("{} Pattern store is empty, seeding {} built-in patterns", LOG_PREFIX, builtin.size());
            ActivePatternSet snapshot = load(builtin);
            persist(() -> patternStore.saveAll(builtin), "seed built-in patterns");
            return snapshot;
        }
        return load(stored == null ? List.of() : stored);
    }

    /**
     * Validate and admit a pattern, replacing any existing pattern with the same
     * id.
     *
     * @throws PatternValidationException
     *             if the pattern is invalid; the registry is left unchanged
     */
    public ResponsePattern upsert(ResponsePattern pattern) {
        ResponsePattern stamped = pattern == null ? null : pattern.copy();
        if (stamped != null) {
            stamped.setUpdatedAt(clock.instant());
        }
        CompiledPattern compiled = validator.compile(stamped);

        synchronized (writeLock) {
            boolean replaced = swap(patterns -> {
                patterns.put(compiled.getId(), compiled);
                return patterns;
            });
            log.info("{} {} pattern '{}'", LOG_PREFIX, replaced ? "Updated" : "Added", compiled.getId());
            ResponsePattern saved = compiled.getPattern();
            persist(() -> patternStore.save(saved), "save pattern " + compiled.getId());
            return saved;
        }
    }

    public boolean remove(String patternId) {
        synchronized (writeLock) {
            if (!current.get().contains(patternId)) {
                return false;
            }
            swap(patterns -> {
                patterns.remove(patternId);
                return patterns;
            });
            log.info("{} Removed pattern '{}'", LOG_PREFIX, patternId);
            persist(() -> patternStore.delete(patternId), "delete pattern " + patternId);
            return true;
        }
    }

    /**
     * Keep the pattern in the registry but exclude it from classification.
     */
    public boolean disable(String patternId) {
        synchronized (writeLock) {
            Optional<CompiledPattern> existing = current.get().find(patternId);
            if (existing.isEmpty()) {
                return false;
            }
            ResponsePattern disabled = existing.get().getPattern();
            disabled.setEnabled(false);
            disabled.setUpdatedAt(clock.instant());
            CompiledPattern compiled = validator.compile(disabled);
            swap(patterns -> {
                patterns.put(patternId, compiled);
                return patterns;
            });
            log.info("{} Disabled pattern '{}'", LOG_PREFIX, patternId);
            persist(() -> patternStore.save(disabled), "save pattern " + patternId);
            return true;
        }
    }

    /**
     * Write active patterns to the store.
     *
     * @return number of patterns written
     */
    public int sync(boolean overwrite) {
        ActivePatternSet snapshot = current.get();
        Set<String> storedIds = patternStore.loadAll().stream()
                .map(ResponsePattern::getId)
                .collect(Collectors.toSet());
        int written = 0;
        for (CompiledPattern pattern : snapshot.getPatterns()) {
            if (storedIds.contains(pattern.getId()) && !overwrite) {
                continue;
            }
            patternStore.save(pattern.getPattern());
            written++;
        }
        log.info("{} Synced {} patterns to store (overwrite={})", LOG_PREFIX, written, overwrite);
        return written;
    }

    public List<ResponsePattern> list(boolean enabledOnly) {
        return current.get().getPatterns().stream()
                .filter(p -> !enabledOnly || p.isEnabled())
                .map(CompiledPattern::getPattern)
                .toList();
    }

    public Optional<ResponsePattern> get(String patternId) {
        return current.get().find(patternId).map(CompiledPattern::getPattern);
    }

    public PatternSummary summary() {
        ActivePatternSet snapshot = current.get();
        List<PatternSummary.Entry> entries = new ArrayList<>();
        for (CompiledPattern pattern : snapshot.getPatterns()) {
            ResponsePattern source = pattern.getPattern();
            entries.add(PatternSummary.Entry.builder()
                    .id(source.getId())
                    .description(source.getDescription())
                    .messageType(source.getMessageType())
                    .priority(source.getPriority())
                    .enabled(source.isEnabled())
                    .build());
        }
        int active = (int) snapshot.enabledCount();
        return PatternSummary.builder()
                .version(snapshot.getVersion())
                .total(snapshot.size())
                .active(active)
                .inactive(snapshot.size() - active)
                .patterns(entries)
                .build();
    }

    /**
     * Apply an edit to a copy of the current patterns and publish the result.
     * Must be called while holding {@link #writeLock}.
     *
     * @return true if the edit changed an existing id
     */
    private boolean swap(UnaryOperator<Map<String, CompiledPattern>> edit) {
        ActivePatternSet before = current.get();
        Map<String, CompiledPattern> patterns = new LinkedHashMap<>();
        for (CompiledPattern pattern : before.getPatterns()) {
            patterns.put(pattern.getId(), pattern);
        }
        Map<String, CompiledPattern> edited = edit.apply(patterns);
        boolean existed = before.getPatterns().stream()
                .anyMatch(p -> edited.containsKey(p.getId()) && edited.get(p.getId()) != p);
        current.set(newSnapshot(edited.values()));
        return existed;
    }

    private ActivePatternSet newSnapshot(Collection<CompiledPattern> patterns) {
        return new ActivePatternSet(versionSequence.incrementAndGet(), patterns);
    }

    private void persist(Runnable write, String action) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.warn("{} Failed to {}: {}", LOG_PREFIX, action, e.getMessage());
        }
    }
}
