package me.golemcore.responder.domain.service;

import me.golemcore.responder.domain.exception.PatternValidationException;
import me.golemcore.responder.domain.model.CompiledPattern;
import me.golemcore.responder.domain.model.MessageType;
import me.golemcore.responder.domain.model.ResponderFailureKind;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.domain.model.ResponsePriority;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternValidatorTest {

    private final PatternValidator validator = new PatternValidator();

    private static ResponsePattern.ResponsePatternBuilder valid() {
        return ResponsePattern.builder()
                .id("greeting")
                .trigger("^hello")
                .messageType(MessageType.GREETING)
                .priority(ResponsePriority.IMMEDIATE)
                .template("Hi!")
                .keywords(new LinkedHashSet<>(List.of("Hello", "HI", " ")));
    }

    @Test
    void compilesCaseInsensitiveTrigger() {
        CompiledPattern compiled = validator.compile(valid().build());

        assertTrue(compiled.matches("HELLO world"));
        assertFalse(compiled.matches("well hello"));
        assertEquals(List.of("hello", "hi"), compiled.getKeywords());
    }

    @Test
    void compiledPatternDoesNotShareStateWithSource() {
        ResponsePattern source = valid().build();
        CompiledPattern compiled = validator.compile(source);

        source.setTemplate("changed");
        source.getKeywords().add("new");

        assertEquals("Hi!", compiled.getPattern().getTemplate());
        assertFalse(compiled.getPattern().getKeywords().contains("new"));
    }

    @Test
    void rejectsInvalidRegex() {
        PatternValidationException e = assertThrows(PatternValidationException.class,
                () -> validator.compile(valid().trigger("(unclosed").build()));

        assertEquals("greeting", e.getPatternId());
        assertEquals(ResponderFailureKind.VALIDATION, e.getFailureKind());
    }

    @Test
    void rejectsOutOfRangeConfidence() {
        assertThrows(PatternValidationException.class,
                () -> validator.compile(valid().minConfidence(1.2).build()));
        assertThrows(PatternValidationException.class,
                () -> validator.compile(valid().baseConfidence(-0.1).build()));
        assertThrows(PatternValidationException.class,
                () -> validator.compile(valid().minConfidence(Double.NaN).build()));
    }

    @Test
    void rejectsMissingFields() {
        assertThrows(PatternValidationException.class, () -> validator.compile(null));
        assertThrows(PatternValidationException.class, () -> validator.compile(valid().id(" ").build()));
        assertThrows(PatternValidationException.class, () -> validator.compile(valid().trigger("").build()));
        assertThrows(PatternValidationException.class, () -> validator.compile(valid().messageType(null).build()));
        assertThrows(PatternValidationException.class, () -> validator.compile(valid().priority(null).build()));
        assertThrows(PatternValidationException.class, () -> validator.compile(valid().template(" ").build()));
    }
}
