package me.golemcore.responder.domain.service;

import me.golemcore.responder.adapter.outbound.history.GuardConversationHistoryAdapter;
import me.golemcore.responder.domain.exception.GuardUnavailableException;
import me.golemcore.responder.domain.model.Classification;
import me.golemcore.responder.domain.model.DecisionReason;
import me.golemcore.responder.domain.model.DecisionResult;
import me.golemcore.responder.domain.model.GuardCheck;
import me.golemcore.responder.domain.model.MessageOrigin;
import me.golemcore.responder.domain.model.MessageType;
import me.golemcore.responder.domain.model.ResponsePriority;
import me.golemcore.responder.domain.model.UserContext;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import me.golemcore.responder.port.outbound.PatternStorePort;
import me.golemcore.responder.ratelimit.ResponseGuard;
import me.golemcore.responder.ratelimit.SlidingWindowResponseGuard;
import me.golemcore.responder.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DecisionEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");
    private static final String USER = "user-1";

    private ResponderProperties properties;
    private MutableClock clock;
    private PatternRegistry registry;
    private MessageClassifier classifier;
    private SlidingWindowResponseGuard guard;
    private DecisionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new ResponderProperties();
        clock = new MutableClock(T0);
        registry = new PatternRegistry(mock(PatternStorePort.class), new PatternValidator(), properties, clock);
        registry.load(BuiltinPatterns.defaults());
        classifier = new MessageClassifier(properties, new MessageSignalDetector(properties));
        guard = new SlidingWindowResponseGuard(properties, clock);
        engine = new DecisionEngine(registry, guard, new GuardConversationHistoryAdapter(guard), properties, clock);
    }

    private Classification classify(String text) {
        return classifier.classify(text, registry.currentSnapshot());
    }

    private static UserContext user() {
        return UserContext.builder().userId(USER).build();
    }

    // ===== Accept =====

    @Test
    void confidentGreetingRespondsImmediately() {
        DecisionResult result = engine.decide(classify("Hello!"), user(), List.of());

        assertTrue(result.isShouldRespond());
        assertEquals(ResponsePriority.IMMEDIATE, result.getPriority());
        assertEquals(DecisionReason.PATTERN_MATCHED, result.getReason());
        assertEquals(BuiltinPatterns.GREETING_HELLO, result.getMatchedPatternId());
    }

    @Test
    void questionUsesPatternPriority() {
        DecisionResult result = engine.decide(classify("how do I reset my password?"), user(), List.of());

        assertTrue(result.isShouldRespond());
        assertEquals(ResponsePriority.HIGH, result.getPriority());
    }

    @Test
    void decidingDoesNotCountAsResponse() {
        engine.decide(classify("Hello!"), user(), List.of());

        assertEquals(0, guard.checkRate(USER, false, List.of(), T0).getRecentCount());
    }

    // ===== Low confidence =====

    @Test
    void unmatchedTextDefersWithLowConfidence() {
        DecisionResult result = engine.decide(classify("the sky is blue"), user(), List.of());

        assertFalse(result.isShouldRespond());
        assertEquals(DecisionReason.LOW_CONFIDENCE, result.getReason());
    }

    @Test
    void matchBelowPatternMinimumDefers() {
        Classification classification = classify("could you send the file");
        assertEquals(BuiltinPatterns.REQUEST_PLEASE, classification.getMatchedPatternId());

        DecisionResult result = engine.decide(classification, user(), List.of());

        assertFalse(result.isShouldRespond());
        assertEquals(DecisionReason.LOW_CONFIDENCE, result.getReason());
    }

    @Test
    void patternDisabledAfterClassificationDefers() {
        Classification classification = classify("Hello!");
        registry.disable(BuiltinPatterns.GREETING_HELLO);

        DecisionResult result = engine.decide(classification, user(), List.of());

        assertEquals(DecisionReason.LOW_CONFIDENCE, result.getReason());
    }

    // ===== Rate limiting =====

    @Test
    void fourthGreetingWithinHourIsRateLimited() {
        DecisionResult last = null;
        for (int i = 0; i < 4; i++) {
            clock.advance(Duration.ofMinutes(5));
            last = engine.decide(classify("Hello!"), user(), List.of());
            if (last.isShouldRespond()) {
                guard.recordResponse(USER, clock.instant());
            }
            if (i < 3) {
                assertTrue(last.isShouldRespond(), "greeting " + (i + 1));
            }
        }

        assertFalse(last.isShouldRespond());
        assertEquals(DecisionReason.RATE_LIMITED, last.getReason());
        assertEquals(BuiltinPatterns.GREETING_HELLO, last.getMatchedPatternId());
    }

    @Test
    void premiumUserIsNeverRateLimited() {
        UserContext premium = UserContext.builder().userId(USER).premium(true).build();
        for (int i = 0; i < 20; i++) {
            DecisionResult result = engine.decide(classify("Hello!"), premium, List.of());
            assertTrue(result.isShouldRespond());
            assertNotEquals(DecisionReason.RATE_LIMITED, result.getReason());
            guard.recordResponse(USER, clock.instant());
        }
    }

    @Test
    void callerSuppliedTimestampsAreHonoured() {
        UserContext context = UserContext.builder()
                .userId(USER)
                .recentAutoResponseTimestamps(List.of(T0.minusSeconds(60), T0.minusSeconds(120), T0.minusSeconds(180)))
                .build();

        DecisionResult result = engine.decide(classify("Hello!"), context, List.of());

        assertEquals(DecisionReason.RATE_LIMITED, result.getReason());
    }

    // ===== Loop detection =====

    @Test
    void loopIsDetectedEvenAtMaximumConfidence() {
        Classification classification = classify("/status");
        assertEquals(1.0, classification.getConfidence(), 1e-9);

        DecisionResult result = engine.decide(classification, user(),
                List.of(MessageOrigin.USER, MessageOrigin.AUTOMATIC, MessageOrigin.EXTERNAL));

        assertFalse(result.isShouldRespond());
        assertEquals(DecisionReason.LOOP_DETECTED, result.getReason());
    }

    @Test
    void trackedHistoryIsUsedWhenNoneSupplied() {
        guard.recordOrigin(USER, MessageOrigin.AUTOMATIC);
        guard.recordOrigin(USER, MessageOrigin.AUTOMATIC);

        DecisionResult result = engine.decide(classify("Hello!"), user(), null);

        assertEquals(DecisionReason.LOOP_DETECTED, result.getReason());
    }

    // ===== Urgency =====

    @Test
    void urgentMessageBypassesRateLimit() {
        for (int i = 0; i < 3; i++) {
            guard.recordResponse(USER, T0.minusSeconds(i));
        }

        DecisionResult result = engine.decide(classify("HELP ASAP!!"), user(), List.of());

        assertTrue(result.isShouldRespond());
        assertEquals(ResponsePriority.IMMEDIATE, result.getPriority());
        assertEquals(DecisionReason.URGENT, result.getReason());
        assertEquals(BuiltinPatterns.URGENT_ASAP, result.getMatchedPatternId());
    }

    @Test
    void urgentMessageWithoutPatternGetsGenericAcknowledgment() {
        registry.load(List.of());
        Classification classification = classify("HELP ASAP!!");
        assertEquals(MessageType.STATEMENT, classification.getDetectedType());

        DecisionResult result = engine.decide(classification, user(), List.of());

        assertTrue(result.isShouldRespond());
        assertTrue(result.isUrgentAcknowledgment());
        assertEquals(ResponsePriority.IMMEDIATE, result.getPriority());
        assertNull(result.getMatchedPatternId());
    }

    @Test
    void urgentMessageStillRespectsLoopDetection() {
        DecisionResult result = engine.decide(classify("HELP ASAP!!"), user(),
                List.of(MessageOrigin.AUTOMATIC, MessageOrigin.AUTOMATIC));

        assertEquals(DecisionReason.LOOP_DETECTED, result.getReason());
    }

    // ===== Failures =====

    @Test
    void guardFailureDefersInsteadOfBypassing() {
        ResponseGuard failing = mock(ResponseGuard.class);
        when(failing.checkLoop(any())).thenThrow(new GuardUnavailableException("state store down"));
        DecisionEngine failingEngine = new DecisionEngine(registry, failing,
                new GuardConversationHistoryAdapter(failing), properties, clock);

        DecisionResult result = failingEngine.decide(classify("Hello!"), user(), List.of());

        assertFalse(result.isShouldRespond());
        assertEquals(DecisionReason.GUARD_UNAVAILABLE, result.getReason());
    }

    @Test
    void rateCheckFailureDefers() {
        ResponseGuard failing = mock(ResponseGuard.class);
        when(failing.checkLoop(any())).thenReturn(GuardCheck.allowed(0, 2));
        when(failing.checkRate(any(), anyBoolean(), any(), any()))
                .thenThrow(new GuardUnavailableException("timeout"));
        DecisionEngine failingEngine = new DecisionEngine(registry, failing,
                new GuardConversationHistoryAdapter(failing), properties, clock);

        DecisionResult result = failingEngine.decide(classify("Hello!"), user(), List.of());

        assertEquals(DecisionReason.GUARD_UNAVAILABLE, result.getReason());
    }

    @Test
    void missingInputDefers() {
        assertEquals(DecisionReason.INVALID_INPUT, engine.decide(null, user(), List.of()).getReason());
        assertEquals(DecisionReason.INVALID_INPUT,
                engine.decide(classify("Hello!"), UserContext.builder().build(), List.of()).getReason());
    }

    @Test
    void everyMessageTypeHasDefaultPriority() {
        for (MessageType type : MessageType.values()) {
            assertNotNull(DecisionEngine.defaultPriority(type));
        }
    }
}
