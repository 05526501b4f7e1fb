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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Rule pairing a regular-expression trigger with a canned response template
 * and the metadata used to score and prioritize it.
 *
 * <p>
 * Patterns are mutable holders while being edited through the administration
 * surface. Once admitted by the registry a copy is compiled into an
 * {@link ActivePatternSet} and never changes afterwards.
 *
 * <p>
 * Template placeholders use {@code {{name}}} or {@code {{name|default}}}
 * syntax, see {@code ResponseTemplateEngine}.
 *
 * @since 1.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResponsePattern {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.7;

    private String id;

    /**
     * Regular expression matched case-insensitively anywhere in the text.
     */
    private String trigger;

    private MessageType messageType;
    private String description;
    private String template;

    @Builder.Default
    private ResponsePriority priority = ResponsePriority.MEDIUM;

    @Builder.Default
    private Set<String> keywords = new LinkedHashSet<>();

    /**
     * Confidence contributed by a trigger match before keyword bonuses. When
     * null the classifier's configured base confidence applies.
     */
    private Double baseConfidence;

    @Builder.Default
    private double minConfidence = DEFAULT_MIN_CONFIDENCE;

    @Builder.Default
    private boolean requiresContext = false;

    /**
     * Context keys that must be present when {@link #requiresContext} is set. An
     * empty set means every placeholder without a default that the generator
     * does not derive itself.
     */
    @Builder.Default
    private Set<String> requiredContext = new LinkedHashSet<>();

    @Builder.Default
    private boolean enabled = true;

    private Instant updatedAt;

    /**
     * Deep copy that does not share the keyword or context sets.
     */
    public ResponsePattern copy() {
        return toBuilder()
                .keywords(keywords == null ? new LinkedHashSet<>() : new LinkedHashSet<>(keywords))
                .requiredContext(requiredContext == null ? new LinkedHashSet<>() : new LinkedHashSet<>(requiredContext))
                .build();
    }
}
