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

import me.golemcore.responder.domain.exception.InvalidInputException;
import me.golemcore.responder.domain.model.ActivePatternSet;
import me.golemcore.responder.domain.model.Classification;
import me.golemcore.responder.domain.model.CompiledPattern;
import me.golemcore.responder.domain.model.MessageType;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Rule-based classifier that scores a message against every enabled pattern of
 * a snapshot.
 *
 * <p>
 * Scoring per pattern:
 * <ol>
 * <li>the trigger must match somewhere in the text (case-insensitive); a match
 * contributes the pattern's base confidence</li>
 * <li>each of the pattern's keywords present in the text adds
 * {@code keyword-bonus}; the total is clamped to 1.0</li>
 * </ol>
 * The highest score wins; ties keep the earlier pattern in snapshot order. When
 * nothing matches, or the best score is below {@code confidence-floor}, the
 * result is {@link MessageType#STATEMENT} at the floor confidence with no
 * matched pattern.
 *
 * <p>
 * The classifier is stateless, performs no I/O and is safe for concurrent use.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageClassifier {

    private static final String LOG_PREFIX = "[Classifier]";
    private static final int LOG_TEXT_LIMIT = 80;

    private final ResponderProperties properties;
    private final MessageSignalDetector signalDetector;

    /**
     * @throws InvalidInputException
     *             if the text is null, blank, not valid text or longer than
     *             {@code max-text-length}
     */
    public Classification classify(String text, ActivePatternSet snapshot) {
        validate(text);
        ResponderProperties.ClassifierProperties config = properties.getClassifier();
        String normalized = TextMatching.normalize(text);

        CompiledPattern best = null;
        double bestConfidence = 0.0;
        List<String> bestKeywords = List.of();

        for (CompiledPattern pattern : snapshot.getPatterns()) {
            if (!pattern.isEnabled() || !pattern.matches(text)) {
                continue;
            }
            List<String> keywords = matchedKeywords(pattern, normalized);
            double confidence = score(pattern, keywords.size(), config);
            log.trace("{} '{}' matched with confidence {}", LOG_PREFIX, pattern.getId(), confidence);
            if (best == null || confidence > bestConfidence) {
                best = pattern;
                bestConfidence = confidence;
                bestKeywords = keywords;
            }
        }

        Classification.ClassificationBuilder result = Classification.builder()
                .rawText(text)
                .hasUrgencyMarkers(signalDetector.hasUrgencyMarkers(text))
                .hasMentions(signalDetector.hasMentions(text))
                .sentiment(signalDetector.detectSentiment(text))
                .snapshotVersion(snapshot.getVersion());

        double floor = config.getConfidenceFloor();
        if (best == null || bestConfidence < floor) {
            log.debug("{} No confident match for '{}', falling back to STATEMENT", LOG_PREFIX,
                    truncate(text));
            return result
                    .detectedType(MessageType.STATEMENT)
                    .confidence(floor)
                    .build();
        }

        log.debug("{} '{}' classified as {} by '{}' (confidence {})", LOG_PREFIX, truncate(text),
                best.getMessageType(), best.getId(), String.format("%.2f", bestConfidence));
        return result
                .detectedType(best.getMessageType())
                .confidence(bestConfidence)
                .matchedPatternId(best.getId())
                .matchedKeywords(new LinkedHashSet<>(bestKeywords))
                .build();
    }

    /**
     * Decode strict UTF-8 and classify.
     *
     * @throws InvalidInputException
     *             if the bytes are not valid UTF-8
     */
    public Classification classify(byte[] utf8Text, ActivePatternSet snapshot) {
        if (utf8Text == null) {
            throw new InvalidInputException("Message text is missing");
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(utf8Text))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidInputException("Message is not valid UTF-8 text", e);
        }
        return classify(text, snapshot);
    }

    /**
     * Confidence of a trigger match with the given number of matched keywords.
     * Non-decreasing in {@code keywordCount} and never above 1.0.
     */
    double score(CompiledPattern pattern, int keywordCount, ResponderProperties.ClassifierProperties config) {
        double base = pattern.getBaseConfidence() != null ? pattern.getBaseConfidence() : config.getBaseConfidence();
        double bonus = Math.max(0.0, config.getKeywordBonus());
        return Math.min(1.0, base + keywordCount * bonus);
    }

    private List<String> matchedKeywords(CompiledPattern pattern, String normalizedText) {
        List<String> matched = new ArrayList<>();
        for (String keyword : pattern.getKeywords()) {
            if (TextMatching.containsTerm(normalizedText, keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    private void validate(String text) {
        if (text == null) {
            throw new InvalidInputException("Message text is missing");
        }
        if (text.isBlank()) {
            throw new InvalidInputException("Message text is empty");
        }
        int maxLength = properties.getClassifier().getMaxTextLength();
        if (text.length() > maxLength) {
            throw new InvalidInputException(
                    "Message text exceeds maximum length of " + maxLength + " characters (" + text.length() + ")");
        }
        if (!isWellFormed(text)) {
            throw new InvalidInputException("Message text contains unpaired surrogate characters");
        }
    }

    private boolean isWellFormed(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    return false;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }

    private String truncate(String text) {
        return text.length() <= LOG_TEXT_LIMIT ? text : text.substring(0, LOG_TEXT_LIMIT) + "...";
    }
}
