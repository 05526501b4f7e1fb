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

import me.golemcore.responder.domain.model.Sentiment;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects signals that are independent of pattern matching: urgency markers,
 * mentions and a coarse lexicon-based sentiment.
 *
 * <p>
 * Urgency is flagged when the text contains a token of the configured urgency
 * lexicon ({@code asap}, {@code urgent}, ...) or an all-caps run ending in an
 * exclamation mark ({@code "HELP!"}, {@code "CALL ME NOW!!"}).
 *
 * <p>
 * Sentiment counts positive and negative lexicon hits; ties are neutral.
 */
@Component
@RequiredArgsConstructor
public class MessageSignalDetector {

    private static final Pattern ALL_CAPS_EXCLAMATION = Pattern
            .compile("\\b\\p{Lu}{3,}(?:\\s+\\p{Lu}{2,})*\\s*!+");

    private final ResponderProperties properties;

    public boolean hasUrgencyMarkers(String text) {
        if (ALL_CAPS_EXCLAMATION.matcher(text).find()) {
            return true;
        }
        String normalized = TextMatching.normalize(text);
        return countHits(normalized, properties.getClassifier().getUrgencyTokens()) > 0;
    }

    public boolean hasMentions(String text) {
        return text.indexOf('@') >= 0 || text.toLowerCase(Locale.ROOT).contains("cc:");
    }

    public Sentiment detectSentiment(String text) {
        String normalized = TextMatching.normalize(text);
        ResponderProperties.ClassifierProperties config = properties.getClassifier();
        int positive = countHits(normalized, config.getPositiveWords());
        int negative = countHits(normalized, config.getNegativeWords());
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }

    private int countHits(String normalizedText, List<String> lexicon) {
        if (lexicon == null) {
            return 0;
        }
        int hits = 0;
        for (String term : lexicon) {
            if (term != null && TextMatching.containsTerm(normalizedText, TextMatching.normalize(term))) {
                hits++;
            }
        }
        return hits;
    }
}
