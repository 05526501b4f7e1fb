package me.golemcore.responder.domain.model;

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

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the pattern set used for one classification pass.
 *
 * <p>
 * Patterns are held in evaluation order: priority descending (immediate first),
 * then id ascending. Tie-breaks between equally confident matches follow this
 * order, so results are reproducible across reloads of the same content.
 *
 * <p>
 * The registry swaps whole snapshots; a snapshot is never modified after
 * construction.
 *
 * @since 1.0
 */
public final class ActivePatternSet {

    public static final Comparator<CompiledPattern> EVALUATION_ORDER = Comparator
            .comparingInt((CompiledPattern p) -> p.getPriority().getRank())
            .thenComparing(CompiledPattern::getId);

    private static final ActivePatternSet EMPTY = new ActivePatternSet(0L, List.of());

    private final long version;
    private final List<CompiledPattern> patterns;
    private final Map<String, CompiledPattern> byId;

    public ActivePatternSet(long version, Collection<CompiledPattern> patterns) {
        this.version = version;
        this.patterns = patterns.stream().sorted(EVALUATION_ORDER).toList();
        Map<String, CompiledPattern> index = new LinkedHashMap<>();
        for (CompiledPattern pattern : this.patterns) {
            index.put(pattern.getId(), pattern);
        }
        this.byId = Map.copyOf(index);
    }

    public static ActivePatternSet empty() {
        return EMPTY;
    }

    public long getVersion() {
        return version;
    }

    /**
     * All patterns, enabled or not, in evaluation order.
     */
    public List<CompiledPattern> getPatterns() {
        return patterns;
    }

    public Optional<CompiledPattern> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    public int size() {
        return patterns.size();
    }

    public long enabledCount() {
        return patterns.stream().filter(CompiledPattern::isEnabled).count();
    }

    @Override
    public String toString() {
        return "ActivePatternSet{version=" + version + ", size=" + patterns.size() + "}";
    }
}
