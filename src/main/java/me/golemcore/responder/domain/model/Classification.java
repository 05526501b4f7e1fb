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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Result of classifying one inbound message against a pattern snapshot.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code detectedType} - type of the best pattern, or
 * {@link MessageType#STATEMENT} when nothing matched confidently</li>
 * <li>{@code confidence} - 0..1 score of the best match (or the global floor
 * for the fallback)</li>
 * <li>{@code matchedPatternId} - id of the best pattern, null for the
 * fallback</li>
 * <li>urgency, mention and sentiment signals detected independently of pattern
 * matching</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class Classification {

    private String rawText;
    private MessageType detectedType;
    private double confidence;
    private String matchedPatternId;
    private boolean hasUrgencyMarkers;
    private boolean hasMentions;

    @Builder.Default
    private Sentiment sentiment = Sentiment.NEUTRAL;

    @Builder.Default
    private Set<String> matchedKeywords = new LinkedHashSet<>();

    /**
     * Version of the snapshot this classification was computed against.
     */
    private long snapshotVersion;

    public boolean hasUrgencyMarkers() {
        return hasUrgencyMarkers;
    }

    public boolean hasMentions() {
        return hasMentions;
    }

    public boolean isPatternMatched() {
        return matchedPatternId != null;
    }
}
