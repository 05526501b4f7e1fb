package me.golemcore.responder.domain.service;

import me.golemcore.responder.domain.model.Sentiment;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageSignalDetectorTest {

    private ResponderProperties properties;
    private MessageSignalDetector detector;

    @BeforeEach
    void setUp() {
        properties = new ResponderProperties();
        detector = new MessageSignalDetector(properties);
    }

    @Test
    void detectsUrgencyTokensCaseInsensitively() {
        assertTrue(detector.hasUrgencyMarkers("Need this ASAP please"));
        assertTrue(detector.hasUrgencyMarkers("this is urgent"));
        assertTrue(detector.hasUrgencyMarkers("Emergency at the office"));
    }

    @Test
    void urgencyTokensRequireWordBoundaries() {
        assertFalse(detector.hasUrgencyMarkers("the emergent behaviour is interesting"));
    }

    @Test
    void detectsAllCapsExclamationRuns() {
        assertTrue(detector.hasUrgencyMarkers("SERVER DOWN!!"));
        assertTrue(detector.hasUrgencyMarkers("please HELP!"));
        assertFalse(detector.hasUrgencyMarkers("OK!"));
        assertFalse(detector.hasUrgencyMarkers("HELLO there"));
    }

    @Test
    void urgencyLexiconIsConfigurable() {
        properties.getClassifier().setUrgencyTokens(List.of("pronto"));

        assertTrue(detector.hasUrgencyMarkers("answer pronto"));
        assertFalse(detector.hasUrgencyMarkers("answer asap"));
    }

    @Test
    void detectsMentions() {
        assertTrue(detector.hasMentions("hey @alice look"));
        assertTrue(detector.hasMentions("CC: bob"));
        assertFalse(detector.hasMentions("plain text"));
    }

    @Test
    void sentimentComparesLexiconHits() {
        properties.getClassifier().setPositiveWords(List.of("great", "love"));
        properties.getClassifier().setNegativeWords(List.of("broken", "hate"));

        assertEquals(Sentiment.POSITIVE, detector.detectSentiment("I love this, great work"));
        assertEquals(Sentiment.NEGATIVE, detector.detectSentiment("it is broken"));
        assertEquals(Sentiment.NEUTRAL, detector.detectSentiment("great but broken"));
        assertEquals(Sentiment.NEUTRAL, detector.detectSentiment("nothing to see"));
    }
}
