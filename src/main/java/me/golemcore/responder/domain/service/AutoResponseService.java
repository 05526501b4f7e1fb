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
import me.golemcore.responder.domain.exception.ResponderException;
import me.golemcore.responder.domain.exception.TemplateException;
import me.golemcore.responder.domain.model.AutoResponseOutcome;
import me.golemcore.responder.domain.model.Classification;
import me.golemcore.responder.domain.model.DecisionReason;
import me.golemcore.responder.domain.model.DecisionResult;
import me.golemcore.responder.domain.model.GuardCheck;
import me.golemcore.responder.domain.model.MessageOrigin;
import me.golemcore.responder.domain.model.ResponderFailureKind;
import me.golemcore.responder.domain.model.ResponderResult;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.domain.model.StatRecord;
import me.golemcore.responder.domain.model.UserContext;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import me.golemcore.responder.port.inbound.AutoResponsePort;
import me.golemcore.responder.port.outbound.ConversationHistoryPort;
import me.golemcore.responder.ratelimit.ResponseGuard;
import me.golemcore.responder.stats.StatsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for message handlers. Wires the registry snapshot, classifier,
 * decision engine, generator, guard and stats recorder behind
 * {@link AutoResponsePort}.
 *
 * <p>
 * Recording an outcome with {@code sent=true} is what counts a response
 * against the user's rolling window, so it happens exactly once per sent
 * response and only for an outcome the stats recorder accepted.
 * {@link #handle} treats returning a rendered response as sending it and
 * claims the slot atomically through
 * {@link ResponseGuard#recordResponseIfAllowed}.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoResponseService implements AutoResponsePort {

    private static final String LOG_PREFIX = "[AutoResponse]";
    private static final int LOG_TEXT_LIMIT = 60;

    private final PatternRegistry patternRegistry;
    private final MessageClassifier classifier;
    private final DecisionEngine decisionEngine;
    private final ResponseGenerator responseGenerator;
    private final ResponseGuard responseGuard;
    private final StatsRecorder statsRecorder;
    private final ConversationHistoryPort conversationHistory;
    private final ResponderProperties properties;
    private final Clock clock;

    @Override
    public ResponderResult<Classification> classify(String text) {
        return guarded("classify", () -> classifier.classify(text, patternRegistry.currentSnapshot()));
    }

    @Override
    public ResponderResult<Classification> classify(byte[] utf8Text) {
        return guarded("classify", () -> classifier.classify(utf8Text, patternRegistry.currentSnapshot()));
    }

    @Override
    public ResponderResult<DecisionResult> decide(Classification classification, UserContext userContext,
            List<MessageOrigin> history) {
        return guarded("decide", () -> decisionEngine.decide(classification, userContext, history));
    }

    @Override
    public ResponderResult<String> generate(Classification classification, UserContext userContext,
            ResponsePattern pattern) {
        return guarded("generate", () -> responseGenerator.generate(classification, userContext, pattern));
    }

    @Override
    public ResponderResult<String> record(StatRecord outcome) {
        if (outcome == null) {
            return ResponderResult.failure(ResponderFailureKind.INVALID_INPUT, "Outcome is required");
        }
        return guarded("record", () -> {
            Instant sentAt = outcome.getTimestamp() != null ? outcome.getTimestamp() : clock.instant();
            String recordId = statsRecorder.record(outcome);
            if (outcome.isSent() && outcome.getUserId() != null) {
                countSentResponse(outcome.getUserId(), sentAt);
            }
            return recordId;
        });
    }

    @Override
    public ResponderResult<StatRecord> attachFeedback(String recordId, boolean accepted, String note) {
        return guarded("attachFeedback", () -> statsRecorder.attachFeedback(recordId, accepted, note));
    }

    @Override
    public AutoResponseOutcome handle(String text, UserContext userContext, List<MessageOrigin> history) {
        Instant now = clock.instant();
        Classification classification;
        try {
            classification = classifier.classify(text, patternRegistry.currentSnapshot());
        } catch (ResponderException e) {
            log.debug("{} Rejected message: {}", LOG_PREFIX, e.getMessage());
            return AutoResponseOutcome.builder()
                    .decision(DecisionResult.defer(DecisionReason.INVALID_INPUT, null))
                    .failureKind(e.getFailureKind())
                    .error(e.getMessage())
                    .build();
        } catch (RuntimeException e) {
            log.warn("{} Classification failed, deferring", LOG_PREFIX, e);
            return AutoResponseOutcome.builder()
                    .decision(DecisionResult.defer(DecisionReason.INVALID_INPUT, null))
                    .failureKind(ResponderFailureKind.INTERNAL)
                    .error(e.getMessage())
                    .build();
        }

        List<MessageOrigin> origins = resolveHistory(userContext, history);
        DecisionResult decision;
        try {
            decision = decisionEngine.decide(classification, userContext, origins, now);
        } catch (RuntimeException e) {
            log.warn("{} Decision failed, deferring", LOG_PREFIX, e);
            return AutoResponseOutcome.builder()
                    .classification(classification)
                    .decision(DecisionResult.defer(DecisionReason.GUARD_UNAVAILABLE,
                            classification.getMatchedPatternId()))
                    .failureKind(ResponderFailureKind.INTERNAL)
                    .error(e.getMessage())
                    .build();
        }

        AutoResponseOutcome.AutoResponseOutcomeBuilder outcome = AutoResponseOutcome.builder()
                .classification(classification)
                .decision(decision);

        String response = null;
        if (decision.isShouldRespond()) {
            try {
                response = render(classification, userContext, decision, origins);
            } catch (TemplateException e) {
                log.info("{} Generation failed closed for pattern '{}': {}", LOG_PREFIX,
                        decision.getMatchedPatternId(), e.getMessage());
                decision = DecisionResult.defer(DecisionReason.MISSING_CONTEXT, decision.getMatchedPatternId());
                outcome.decision(decision)
                        .failureKind(ResponderFailureKind.TEMPLATE)
                        .error(e.getMessage());
            } catch (RuntimeException e) {
                log.warn("{} Generation failed, deferring", LOG_PREFIX, e);
                decision = DecisionResult.defer(decision.getReason(), decision.getMatchedPatternId());
                outcome.decision(decision)
                        .failureKind(ResponderFailureKind.INTERNAL)
                        .error(e.getMessage());
            }
        }

        String userId = userContext != null ? userContext.getUserId() : null;
        if (response != null && userId != null) {
            DecisionResult claimed = claimSendSlot(userContext, decision, now);
            if (!claimed.isShouldRespond()) {
                decision = claimed;
                response = null;
                outcome.decision(decision);
            }
        }
        outcome.response(response);
        appendOrigins(userContext, response != null);

        StatRecord statRecord = StatRecord.builder()
                .patternId(response != null ? decision.getMatchedPatternId() : null)
                .userId(userId)
                .timestamp(now)
                .sent(response != null)
                .reason(decision.getReason())
                .messageContent(text)
                .responseContent(response)
                .build();
        try {
            outcome.statRecordId(statsRecorder.record(statRecord));
        } catch (RuntimeException e) {
            log.warn("{} Failed to record outcome: {}", LOG_PREFIX, e.getMessage());
        }

        log.debug("{} '{}' -> {} ({})", LOG_PREFIX, abbreviate(text),
                response != null ? "respond" : "defer", decision.describe());
        return outcome.build();
    }

    @Override
    public void recordOrigin(String conversationId, MessageOrigin origin) {
        if (conversationId == null || origin == null) {
            return;
        }
        try {
            conversationHistory.append(conversationId, origin);
        } catch (RuntimeException e) {
            log.warn("{} Failed to record origin for conversation {}: {}", LOG_PREFIX, conversationId,
                    e.getMessage());
        }
    }

    private String render(Classification classification, UserContext userContext, DecisionResult decision,
            List<MessageOrigin> origins) {
        ResponsePattern pattern = null;
        if (!decision.isUrgentAcknowledgment()) {
            Optional<ResponsePattern> matched = patternRegistry.get(decision.getMatchedPatternId());
            if (matched.isEmpty()) {
                throw new TemplateException("Pattern '" + decision.getMatchedPatternId()
                        + "' is no longer registered", List.of());
            }
            pattern = matched.get();
        }
        return responseGenerator.generate(classification, userContext, pattern,
                origins != null ? origins : List.of());
    }

    /**
     * Caller history wins; otherwise the tracked history. Null when the tracked
     * history cannot be read, so the decision engine reports the guard failure.
     */
    private List<MessageOrigin> resolveHistory(UserContext userContext, List<MessageOrigin> history) {
        if (history != null || userContext == null || userContext.getUserId() == null) {
            return history;
        }
        try {
            return conversationHistory.recentOrigins(userContext.resolveConversationId(),
                    properties.getGuard().getHistorySize());
        } catch (GuardUnavailableException e) {
            return null;
        }
    }

    private void appendOrigins(UserContext userContext, boolean responded) {
        if (userContext == null || userContext.resolveConversationId() == null) {
            return;
        }
        String conversationId = userContext.resolveConversationId();
        recordOrigin(conversationId, MessageOrigin.USER);
        if (responded) {
            recordOrigin(conversationId, MessageOrigin.AUTOMATIC);
        }
    }

    /**
     * Count the response against the user's window right before it is returned.
     * Urgent responses bypass the rate limit; any other response is re-checked
     * and counted under the guard's lock and deferred if the last slot was taken
     * concurrently.
     */
    private DecisionResult claimSendSlot(UserContext userContext, DecisionResult decision, Instant now) {
        String userId = userContext.getUserId();
        if (decision.getReason() == DecisionReason.URGENT) {
            countSentResponse(userId, now);
            return decision;
        }
        try {
            GuardCheck check = responseGuard.recordResponseIfAllowed(userId, userContext.isPremium(),
                    userContext.getRecentAutoResponseTimestamps(), now);
            if (check.isAllowed()) {
                return decision;
            }
            log.debug("{} User {} reached the limit before the response was sent, deferring", LOG_PREFIX, userId);
            return DecisionResult.defer(DecisionReason.RATE_LIMITED, decision.getMatchedPatternId());
        } catch (GuardUnavailableException e) {
            log.warn("{} Guard unavailable while counting response for user {}, deferring: {}", LOG_PREFIX,
                    userId, e.getMessage());
            return DecisionResult.defer(DecisionReason.GUARD_UNAVAILABLE, decision.getMatchedPatternId());
        }
    }

    private void countSentResponse(String userId, Instant sentAt) {
        try {
            responseGuard.recordResponse(userId, sentAt);
        } catch (GuardUnavailableException e) {
            log.warn("{} Could not count response for user {}: {}", LOG_PREFIX, userId, e.getMessage());
        }
    }

    private <T> ResponderResult<T> guarded(String operation, Supplier<T> action) {
        try {
            return ResponderResult.success(action.get());
        } catch (ResponderException e) {
            log.debug("{} {} failed: {}", LOG_PREFIX, operation, e.getMessage());
            return ResponderResult.failure(e.getFailureKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} {} failed unexpectedly", LOG_PREFIX, operation, e);
            return ResponderResult.failure(ResponderFailureKind.INTERNAL, e.getMessage());
        }
    }

    private static String abbreviate(String text) {
        if (text == null || text.length() <= LOG_TEXT_LIMIT) {
            return text;
        }
        return text.substring(0, LOG_TEXT_LIMIT) + "...";
    }
}
