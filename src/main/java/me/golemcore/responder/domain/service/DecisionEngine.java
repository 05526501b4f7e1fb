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

import me.golemcore.responder.domain.exception.GuardUnavailableException;
import me.golemcore.responder.domain.model.Classification;
import me.golemcore.responder.domain.model.CompiledPattern;
import me.golemcore.responder.domain.model.DecisionReason;
import me.golemcore.responder.domain.model.DecisionResult;
import me.golemcore.responder.domain.model.GuardCheck;
import me.golemcore.responder.domain.model.MessageOrigin;
import me.golemcore.responder.domain.model.MessageType;
import me.golemcore.responder.domain.model.ResponsePriority;
import me.golemcore.responder.domain.model.UserContext;
import me.golemcore.responder.port.outbound.ConversationHistoryPort;
import me.golemcore.responder.ratelimit.ResponseGuard;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Turns a classification into an accept/defer verdict.
 *
 * <p>
 * Decision table, evaluated in order:
 * <ol>
 * <li>no enabled pattern matched at or above its {@code minConfidence}, and no
 * urgency markers: defer with {@link DecisionReason#LOW_CONFIDENCE}</li>
 * <li>the conversation tail is a run of automated replies: defer with
 * {@link DecisionReason#LOOP_DETECTED}, whatever the confidence</li>
 * <li>urgency markers: respond with {@link ResponsePriority#IMMEDIATE} without
 * a rate check, using the matched pattern or the generic urgency
 * acknowledgment</li>
 * <li>regular user over the rolling limit: defer with
 * {@link DecisionReason#RATE_LIMITED}</li>
 * <li>otherwise respond with the pattern's priority</li>
 * </ol>
 * Guard failures defer with {@link DecisionReason#GUARD_UNAVAILABLE}; rate
 * limits are never bypassed because of them.
 *
 * <p>
 * The engine is stateless; the only state it touches is read through the
 * guard. It never records a response: that is done once the response is
 * actually sent.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionEngine {

    private static final String LOG_PREFIX = "[Decision]";

    private final PatternRegistry patternRegistry;
    private final ResponseGuard responseGuard;
    private final ConversationHistoryPort conversationHistory;
    private final ResponderProperties properties;
    private final Clock clock;

    public DecisionResult decide(Classification classification, UserContext userContext,
            List<MessageOrigin> history) {
        return decide(classification, userContext, history, clock.instant());
    }

    /**
     * @param history
     *            prior message origins, oldest first; null to use the tracked
     *            history of the conversation
     */
    public DecisionResult decide(Classification classification, UserContext userContext,
            List<MessageOrigin> history, Instant now) {
        if (classification == null || userContext == null || userContext.getUserId() == null) {
            return DecisionResult.defer(DecisionReason.INVALID_INPUT, null);
        }

        Optional<CompiledPattern> pattern = resolvePattern(classification);
        boolean confident = pattern.isPresent()
                && classification.getConfidence() >= pattern.get().getMinConfidence();
        boolean urgent = classification.hasUrgencyMarkers();
        String patternId = pattern.map(CompiledPattern::getId).orElse(null);

        if (!confident && !urgent) {
            log.debug("{} Deferring: confidence {} below threshold for {}", LOG_PREFIX,
                    classification.getConfidence(), patternId != null ? patternId : "fallback");
            return DecisionResult.defer(DecisionReason.LOW_CONFIDENCE, classification.getMatchedPatternId());
        }

        try {
            List<MessageOrigin> origins = history != null
                    ? history
                    : conversationHistory.recentOrigins(userContext.resolveConversationId(),
                            properties.getGuard().getHistorySize());
            GuardCheck loop = responseGuard.checkLoop(origins);
            if (!loop.isAllowed()) {
                log.debug("{} Deferring for user {}: loop detected", LOG_PREFIX, userContext.getUserId());
                return DecisionResult.defer(DecisionReason.LOOP_DETECTED, patternId);
            }

            if (urgent) {
                if (confident) {
                    return DecisionResult.respond(ResponsePriority.IMMEDIATE, DecisionReason.URGENT, patternId);
                }
                return DecisionResult.acknowledgeUrgent();
            }

            GuardCheck rate = responseGuard.checkRate(userContext.getUserId(), userContext.isPremium(),
                    userContext.getRecentAutoResponseTimestamps(), now);
            if (!rate.isAllowed()) {
                log.debug("{} Deferring for user {}: rate limited ({}/{})", LOG_PREFIX,
                        userContext.getUserId(), rate.getRecentCount(), rate.getLimit());
                return DecisionResult.defer(DecisionReason.RATE_LIMITED, patternId);
            }
        } catch (GuardUnavailableException e) {
            log.warn("{} Guard unavailable for user {}, deferring: {}", LOG_PREFIX,
                    userContext.getUserId(), e.getMessage());
            return DecisionResult.defer(DecisionReason.GUARD_UNAVAILABLE, patternId);
        }

        CompiledPattern matched = pattern.get();
        ResponsePriority priority = matched.getPriority() != null
                ? matched.getPriority()
                : defaultPriority(matched.getMessageType());
        return DecisionResult.respond(priority, DecisionReason.PATTERN_MATCHED, patternId);
    }

    /**
     * Priority used when a pattern does not declare one.
     */
    static ResponsePriority defaultPriority(MessageType type) {
        return switch (type) {
        case URGENT, COMMAND, GREETING -> ResponsePriority.IMMEDIATE;
        case QUESTION -> ResponsePriority.HIGH;
        case REQUEST, STATEMENT -> ResponsePriority.MEDIUM;
        case FEEDBACK, SMALL_TALK -> ResponsePriority.LOW;
        };
    }

    private Optional<CompiledPattern> resolvePattern(Classification classification) {
        if (!classification.isPatternMatched()) {
            return Optional.empty();
        }
        return patternRegistry.currentSnapshot()
                .find(classification.getMatchedPatternId())
                .filter(CompiledPattern::isEnabled);
    }
}
