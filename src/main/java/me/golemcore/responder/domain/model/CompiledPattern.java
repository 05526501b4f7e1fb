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

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable, pre-compiled view of a {@link ResponsePattern} held inside an
 * {@link ActivePatternSet}. Keywords are lower-cased once so the classifier can
 * match them against lower-cased text without further allocation.
 */
public final class CompiledPattern {

    private final ResponsePattern source;
    private final Pattern trigger;
    private final List<String> keywords;

    public CompiledPattern(ResponsePattern source, Pattern trigger) {
        this.source = Objects.requireNonNull(source, "source");
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.keywords = source.getKeywords() == null
                ? List.of()
                : source.getKeywords().stream()
                        .filter(Objects::nonNull)
                        .map(k -> k.toLowerCase(Locale.ROOT))
                        .filter(k -> !k.isBlank())
                        .distinct()
                        .toList();
    }

    public String getId() {
        return source.getId();
    }

    /**
     * Returns a copy so that callers cannot mutate the snapshot.
     */
    public ResponsePattern getPattern() {
        return source.copy();
    }

    public Pattern getTrigger() {
        return trigger;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public MessageType getMessageType() {
        return source.getMessageType();
    }

    public ResponsePriority getPriority() {
        return source.getPriority();
    }

    public Double getBaseConfidence() {
        return source.getBaseConfidence();
    }

    public double getMinConfidence() {
        return source.getMinConfidence();
    }

    public boolean isEnabled() {
        return source.isEnabled();
    }

    public boolean matches(String text) {
        return trigger.matcher(text).find();
    }
}
