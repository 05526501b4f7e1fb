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

import me.golemcore.responder.domain.model.MessageType;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.domain.model.ResponsePriority;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Default pattern set seeded into an empty store on first start.
 */
public final class BuiltinPatterns {

    public static final String GREETING_HELLO = "greeting_hello";
    public static final String QUESTION_WHAT = "question_what";
    public static final String QUESTION_HOW = "question_how";
    public static final String COMMAND_HELP = "command_help";
    public static final String COMMAND_STATUS = "command_status";
    public static final String COMMAND_CONFIG = "command_config";
    public static final String CRYPTO_TOPIC = "crypto_topic";
    public static final String FEEDBACK_THANKS = "feedback_thanks";
    public static final String SMALL_TALK_HOW_ARE_YOU = "smalltalk_how_are_you";
    public static final String REQUEST_PLEASE = "request_please";
    public static final String URGENT_ASAP = "urgent_asap";

    private BuiltinPatterns() {
    }

    public static List<ResponsePattern> defaults() {
        return List.of(
                pattern(GREETING_HELLO, "^(hello|hi|hey|greetings|salut|bonjour|bonsoir)\\b",
                        MessageType.GREETING, ResponsePriority.IMMEDIATE,
                        "👋 Hello {{firstName|there}}! How can I help you today?",
                        "Greetings", 0.85, 0.8, "hello", "hi", "hey"),
                pattern(QUESTION_WHAT, "(^|\\s)(what|why|when|which|whose|whom)\\s+.*\\?",
                        MessageType.QUESTION, ResponsePriority.HIGH,
                        "🤔 Great question! Let me gather some context...",
                        "Questions starting with what/why/when", 0.8, 0.75, "what", "why", "when", "which"),
                pattern(QUESTION_HOW, "(^|\\s)how\\s+.*\\?",
                        MessageType.QUESTION, ResponsePriority.HIGH,
                        "💡 Here's what I know about that...",
                        "Questions starting with how", 0.8, 0.75, "how"),
                pattern(COMMAND_HELP, "^/help",
                        MessageType.COMMAND, ResponsePriority.IMMEDIATE,
                        "📚 Available commands:\n• /help - Show this menu\n• /status - Current status\n"
                                + "• /config - Configuration\n• /stats - Statistics",
                        "/help command", 0.95, 0.95, "/help"),
                pattern(COMMAND_STATUS, "^/status",
                        MessageType.COMMAND, ResponsePriority.IMMEDIATE,
                        "✅ System status: Online and operational",
                        "/status command", 0.95, 0.95, "/status"),
                pattern(COMMAND_CONFIG, "^/config",
                        MessageType.COMMAND, ResponsePriority.HIGH,
                        "⚙️ Configuration options available. What would you like to configure?",
                        "/config command", 0.95, 0.95, "/config"),
                crypto(),
                pattern(FEEDBACK_THANKS, "(thanks|thank you|appreciate|good job|well done)",
                        MessageType.FEEDBACK, ResponsePriority.LOW,
                        "😊 Thank you! Happy to help.",
                        "Positive feedback", 0.8, 0.8, "thanks", "thank you", "appreciate"),
                pattern(SMALL_TALK_HOW_ARE_YOU, "(how are you|how's it going|what's up)",
                        MessageType.SMALL_TALK, ResponsePriority.LOW,
                        "🙂 All good on my side, {{firstName|friend}}. What can I do for you?",
                        "Small talk", 0.85, 0.8, "how are you"),
                pattern(REQUEST_PLEASE, "\\b(please|could you|can you)\\b",
                        MessageType.REQUEST, ResponsePriority.MEDIUM,
                        "📝 Got it, I'm on it.",
                        "Polite requests", 0.7, 0.75, "please"),
                pattern(URGENT_ASAP, "(asap|urgent|emergency|critical|help me now|now!|!!)",
                        MessageType.URGENT, ResponsePriority.IMMEDIATE,
                        "⚠️ I see this is urgent! Prioritizing...",
                        "Urgency markers", 0.8, 0.85, "asap", "urgent", "emergency", "critical"));
    }

    private static ResponsePattern crypto() {
        ResponsePattern pattern = pattern(CRYPTO_TOPIC, "\\b(bitcoin|btc|crypto|ethereum|eth|blockchain)\\b",
                MessageType.STATEMENT, ResponsePriority.MEDIUM,
                "🔗 {{firstName}}, {{topic}} topic detected. Analyzing...",
                "Crypto/blockchain mentions", 0.7, 0.7,
                "bitcoin", "btc", "crypto", "ethereum", "eth", "blockchain");
        pattern.setRequiresContext(true);
        pattern.setRequiredContext(new LinkedHashSet<>(Set.of("firstName")));
        return pattern;
    }

    private static ResponsePattern pattern(String id, String trigger, MessageType type, ResponsePriority priority,
            String template, String description, double baseConfidence, double minConfidence, String... keywords) {
        return ResponsePattern.builder()
                .id(id)
                .trigger(trigger)
                .messageType(type)
                .priority(priority)
                .template(template)
                .description(description)
                .baseConfidence(baseConfidence)
                .minConfidence(minConfidence)
                .keywords(new LinkedHashSet<>(List.of(keywords)))
                .build();
    }
}
