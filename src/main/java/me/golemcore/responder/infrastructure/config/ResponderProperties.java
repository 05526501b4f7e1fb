package me.golemcore.responder.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the responder core, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code responder.*} prefix:
 * <ul>
 * <li>{@link ClassifierProperties} - confidence constants and lexicons</li>
 * <li>{@link GuardProperties} - rate window and loop detection</li>
 * <li>{@link GeneratorProperties} - response decorations</li>
 * <li>{@link StatsProperties} - async outcome recording</li>
 * <li>{@link PatternsProperties} - registry bootstrap</li>
 * <li>{@link StorageProperties} - local persistence root</li>
 * </ul>
 *
 * <p>
 * Components read these values on every call, so changes made at runtime take
 * effect immediately.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "responder")
@Data
public class ResponderProperties {

    private ClassifierProperties classifier = new ClassifierProperties();
    private GuardProperties guard = new GuardProperties();
    private GeneratorProperties generator = new GeneratorProperties();
    private StatsProperties stats = new StatsProperties();
    private PatternsProperties patterns = new PatternsProperties();
    private StorageProperties storage = new StorageProperties();

    // ==================== CLASSIFIER ====================

    @Data
    public static class ClassifierProperties {
        private double confidenceFloor = 0.5;
        private double baseConfidence = 0.8;
        private double keywordBonus = 0.05;
        private int maxTextLength = 4096;
        private List<String> urgencyTokens = new ArrayList<>(List.of("asap", "urgent", "emergency", "critical"));
        private List<String> positiveWords = new ArrayList<>(List.of(
                "thanks", "thank", "awesome", "great", "love", "nice", "perfect", "excellent",
                "😊", "🎉", "😍", "👍"));
        private List<String> negativeWords = new ArrayList<>(List.of(
                "bad", "terrible", "hate", "awful", "broken", "worst", "angry", "useless",
                "😔", "😠", "😤", "👎"));
    }

    // ==================== GUARD ====================

    @Data
    public static class GuardProperties {
        private int maxResponses = 3;
        private Duration window = Duration.ofHours(1);
        private int loopThreshold = 2;
        private int historySize = 5;
        private int lockStripes = 64;
        private Duration lockTimeout = Duration.ofMillis(50);
        private Duration evictionInterval = Duration.ofMinutes(10);
        private Duration historyTtl = Duration.ofHours(24);
    }

    // ==================== GENERATOR ====================

    @Data
    public static class GeneratorProperties {
        private String urgentAcknowledgment = "⚠️ I see this is urgent! Prioritizing your message...";
        private String premiumPrefix = "✨ ";
        private String urgencyPrefix = "🚨 ";
        private String historySuffix = "(Based on our conversation so far)";
        private String zoneId = "UTC";
    }

    // ==================== STATS ====================

    @Data
    public static class StatsProperties {
        private boolean enabled = true;
        private int queueCapacity = 1000;
        private Duration flushInterval = Duration.ofMillis(500);
        private Duration retention = Duration.ofDays(30);
        private Duration sinkTimeout = Duration.ofSeconds(5);
        private int contentMaxLength = 500;
    }

    // ==================== PATTERNS ====================

    @Data
    public static class PatternsProperties {
        private boolean loadBuiltin = true;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/responder";
    }
}
