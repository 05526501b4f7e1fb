package me.golemcore.responder.domain.service;

import me.golemcore.responder.adapter.outbound.history.GuardConversationHistoryAdapter;
import me.golemcore.responder.domain.model.AutoResponseOutcome;
import me.golemcore.responder.domain.model.Classification;
import me.golemcore.responder.domain.model.DecisionReason;
import me.golemcore.responder.domain.model.DecisionResult;
import me.golemcore.responder.domain.model.MessageOrigin;
import me.golemcore.responder.domain.model.ResponderFailureKind;
import me.golemcore.responder.domain.model.ResponderResult;
import me.golemcore.responder.domain.model.StatRecord;
import me.golemcore.responder.domain.model.UserContext;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import me.golemcore.responder.port.outbound.ConversationHistoryPort;
import me.golemcore.responder.port.outbound.PatternStorePort;
import me.golemcore.responder.port.outbound.StatsSinkPort;
import me.golemcore.responder.ratelimit.SlidingWindowResponseGuard;
import me.golemcore.responder.stats.AsyncStatsRecorder;
import me.golemcore.responder.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AutoResponseServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");
    private static final String USER = "user-1";

    private ResponderProperties properties;
    private PatternRegistry registry;
    private SlidingWindowResponseGuard guard;
    private AsyncStatsRecorder statsRecorder;
    private AutoResponseService service;

    @BeforeEach
    void setUp() {
        properties = new ResponderProperties();
        MutableClock clock = new MutableClock(NOW);
        registry = new PatternRegistry(mock(PatternStorePort.class), new PatternValidator(), properties, clock);
        registry.load(BuiltinPatterns.defaults());
        guard = new SlidingWindowResponseGuard(properties, clock);
        ConversationHistoryPort history = new GuardConversationHistoryAdapter(guard);
        statsRecorder = new AsyncStatsRecorder(mock(StatsSinkPort.class), properties, clock);
        service = new AutoResponseService(
                registry,
                new MessageClassifier(properties, new MessageSignalDetector(properties)),
                new DecisionEngine(registry, guard, history, properties, clock),
                new ResponseGenerator(new ResponseTemplateEngine(), properties, clock),
                guard,
                statsRecorder,
                history,
                properties,
                clock);
    }

    private static UserContext user(String firstName) {
        return UserContext.builder().userId(USER).firstName(firstName).build();
    }

    // ===== handle =====

    @Test
    void handleAnswersConfidentGreeting() {
        AutoResponseOutcome outcome = service.handle("Hello!", user("Ana"), null);

        assertTrue(outcome.isResponded());
        assertEquals("👋 Hello Ana! How can I help you today?", outcome.getResponse());
        assertEquals(DecisionReason.PATTERN_MATCHED, outcome.getDecision().getReason());
        assertNull(outcome.getFailureKind());

        StatRecord recorded = statsRecorder.find(outcome.getStatRecordId()).orElseThrow();
        assertTrue(recorded.isSent());
        assertEquals(BuiltinPatterns.GREETING_HELLO, recorded.getPatternId());
        assertEquals("Hello!", recorded.getMessageContent());
        assertEquals(1, guard.checkRate(USER, false, List.of(), NOW).getRecentCount());
        assertEquals(List.of(MessageOrigin.USER, MessageOrigin.AUTOMATIC), guard.recentOrigins(USER));
    }

    @Test
    void handleDefersUnmatchedText() {
        AutoResponseOutcome outcome = service.handle("the sky is blue", user("Ana"), null);

        assertTrue(outcome.isDeferred());
        assertEquals(DecisionReason.LOW_CONFIDENCE, outcome.getDecision().getReason());
        StatRecord recorded = statsRecorder.find(outcome.getStatRecordId()).orElseThrow();
        assertFalse(recorded.isSent());
        assertNull(recorded.getPatternId());
        assertEquals(0, guard.checkRate(USER, false, List.of(), NOW).getRecentCount());
        assertEquals(List.of(MessageOrigin.USER), guard.recentOrigins(USER));
    }

    @Test
    void handleRejectsInvalidInput() {
        AutoResponseOutcome outcome = service.handle("   ", user("Ana"), null);

        assertTrue(outcome.isDeferred());
        assertNull(outcome.getClassification());
        assertEquals(DecisionReason.INVALID_INPUT, outcome.getDecision().getReason());
        assertEquals(ResponderFailureKind.INVALID_INPUT, outcome.getFailureKind());
    }

    @Test
    void handleRateLimitsFourthGreeting() {
        for (int i = 0; i < 3; i++) {
            assertTrue(service.handle("Hello!", user("Ana"), List.of()).isResponded());
        }

        AutoResponseOutcome fourth = service.handle("Hello!", user("Ana"), List.of());

        assertTrue(fourth.isDeferred());
        assertEquals(DecisionReason.RATE_LIMITED, fourth.getDecision().getReason());
    }

    @Test
    void concurrentHandlesNeverSendMoreThanLimit() throws Exception {
        properties.getGuard().setLockTimeout(Duration.ofSeconds(5));
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AutoResponseOutcome>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                return service.handle("Hello!", user("Ana"), List.of());
            }));
        }
        start.countDown();
        int responded = 0;
        for (Future<AutoResponseOutcome> future : futures) {
            AutoResponseOutcome outcome = future.get(10, TimeUnit.SECONDS);
            if (outcome.isResponded()) {
                responded++;
            } else {
                assertEquals(DecisionReason.RATE_LIMITED, outcome.getDecision().getReason());
                assertNull(outcome.getResponse());
                assertFalse(statsRecorder.find(outcome.getStatRecordId()).orElseThrow().isSent());
            }
        }
        executor.shutdown();

        assertEquals(3, responded);
        assertEquals(3, guard.checkRate(USER, false, List.of(), NOW).getRecentCount());
    }

    @Test
    void urgentResponsesAreSentPastTheLimit() {
        for (int i = 0; i < 3; i++) {
            guard.recordResponse(USER, NOW);
        }

        AutoResponseOutcome outcome = service.handle("HELP ASAP!!", user("Ana"), List.of());

        assertTrue(outcome.isResponded());
        assertEquals(DecisionReason.URGENT, outcome.getDecision().getReason());
        assertEquals(4, guard.checkRate(USER, false, List.of(), NOW).getRecentCount());
    }

    @Test
    void handleDowngradesTemplateFailureToDeferral() {
        AutoResponseOutcome outcome = service.handle("bitcoin is rising", user(null), List.of());

        assertTrue(outcome.isDeferred());
        assertEquals(DecisionReason.MISSING_CONTEXT, outcome.getDecision().getReason());
        assertEquals(ResponderFailureKind.TEMPLATE, outcome.getFailureKind());
        assertEquals(0, guard.checkRate(USER, false, List.of(), NOW).getRecentCount());
        assertFalse(statsRecorder.find(outcome.getStatRecordId()).orElseThrow().isSent());
    }

    @Test
    void handleRendersTopicWhenContextPresent() {
        AutoResponseOutcome outcome = service.handle("bitcoin is rising", user("Ana"), List.of());

        assertEquals("🔗 Ana, bitcoin topic detected. Analyzing...", outcome.getResponse());
    }

    @Test
    void externalRepliesCountTowardsLoopDetection() {
        service.recordOrigin(USER, MessageOrigin.AUTOMATIC);
        service.recordOrigin(USER, MessageOrigin.EXTERNAL);

        AutoResponseOutcome outcome = service.handle("Hello!", user("Ana"), null);

        assertEquals(DecisionReason.LOOP_DETECTED, outcome.getDecision().getReason());
    }

    @Test
    void urgentMessageWithoutPatternGetsAcknowledgment() {
        registry.load(List.of());

        AutoResponseOutcome outcome = service.handle("HELP ASAP!!", user("Ana"), List.of());

        assertEquals("🚨 " + properties.getGenerator().getUrgentAcknowledgment(), outcome.getResponse());
        assertTrue(outcome.getDecision().isUrgentAcknowledgment());
    }

    @Test
    void unavailableGuardDefers() {
        guard.destroy();

        AutoResponseOutcome outcome = service.handle("Hello!", user("Ana"), null);

        assertTrue(outcome.isDeferred());
        assertEquals(DecisionReason.GUARD_UNAVAILABLE, outcome.getDecision().getReason());
    }

    // ===== Individual operations =====

    @Test
    void classifyReturnsFailureInsteadOfThrowing() {
        ResponderResult<Classification> result = service.classify((String) null);

        assertTrue(result.isFailure());
        assertEquals(ResponderFailureKind.INVALID_INPUT, result.getFailureKind());
        assertTrue(service.classify(new byte[] { (byte) 0xFF }).isFailure());
        assertTrue(service.classify("Hello!").isSuccess());
    }

    @Test
    void decideAndGenerateReturnResults() {
        Classification classification = service.classify("Hello!").getValue();

        ResponderResult<DecisionResult> decision = service.decide(classification, user("Ana"), List.of());
        ResponderResult<String> text = service.generate(classification, user("Ana"),
                registry.get(decision.getValue().getMatchedPatternId()).orElseThrow());

        assertTrue(decision.getValue().isShouldRespond());
        assertEquals("👋 Hello Ana! How can I help you today?", text.getValue());
    }

    @Test
    void generateFailureIsTyped() {
        Classification classification = service.classify("bitcoin").getValue();

        ResponderResult<String> text = service.generate(classification, user(null),
                registry.get(BuiltinPatterns.CRYPTO_TOPIC).orElseThrow());

        assertEquals(ResponderFailureKind.TEMPLATE, text.getFailureKind());
    }

    @Test
    void recordingSentOutcomeCountsAgainstWindow() {
        StatRecord sent = StatRecord.builder().userId(USER).patternId("x").sent(true).build();
        StatRecord notSent = StatRecord.builder().userId(USER).sent(false).build();

        assertTrue(service.record(sent).isSuccess());
        assertTrue(service.record(notSent).isSuccess());

        assertEquals(1, guard.checkRate(USER, false, List.of(), NOW).getRecentCount());
        assertEquals(ResponderFailureKind.INVALID_INPUT, service.record(null).getFailureKind());
    }

    @Test
    void rejectedDuplicateOutcomeIsNotCountedAgain() {
        StatRecord sent = StatRecord.builder().id("r1").userId(USER).patternId("x").sent(true).build();

        assertTrue(service.record(sent).isSuccess());
        assertEquals(ResponderFailureKind.VALIDATION, service.record(sent).getFailureKind());
        assertEquals(ResponderFailureKind.VALIDATION, service.record(sent).getFailureKind());

        assertEquals(1, guard.checkRate(USER, false, List.of(), NOW).getRecentCount());
    }

    @Test
    void sentOutcomeIsCountedWhenStatsAreDisabled() {
        properties.getStats().setEnabled(false);

        ResponderResult<String> result = service.record(StatRecord.builder().userId(USER).sent(true).build());

        assertTrue(result.isSuccess());
        assertNull(result.getValue());
        assertEquals(1, guard.checkRate(USER, false, List.of(), NOW).getRecentCount());
    }

    @Test
    void attachFeedbackMapsErrorsToFailures() {
        String id = service.record(StatRecord.builder().userId(USER).sent(false).build()).getValue();

        assertTrue(service.attachFeedback(id, true, "ok").isSuccess());
        assertEquals(ResponderFailureKind.VALIDATION, service.attachFeedback(id, true, "again").getFailureKind());
        assertEquals(ResponderFailureKind.NOT_FOUND, service.attachFeedback("nope", true, null).getFailureKind());
    }
}
