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

import me.golemcore.responder.domain.exception.TemplateException;
import me.golemcore.responder.domain.model.Classification;
import me.golemcore.responder.domain.model.MessageOrigin;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.domain.model.UserContext;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders the response for a chosen pattern against message and user context.
 *
 * <p>
 * Variables available to templates:
 * <ul>
 * <li>caller context: {@code firstName}, {@code userId} and every entry of
 * {@link UserContext#getAttributes()}</li>
 * <li>derived: {@code timeOfDayGreeting}, {@code messageType},
 * {@code keywords} (comma separated), {@code topic} (first matched
 * keyword)</li>
 * </ul>
 *
 * <p>
 * When the pattern sets {@code requiresContext}, every required key must come
 * from the caller context (derived values and template defaults do not count).
 * Otherwise generation fails closed with {@link TemplateException}. Without an
 * explicit {@code requiredContext} the required keys are the placeholders that
 * have no default and are not derived.
 *
 * <p>
 * The rendered body is decorated with the premium prefix, the conversation
 * suffix (when history holds more than one entry) and, outermost, the urgency
 * prefix. Output is deterministic for identical inputs and clock.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseGenerator {

    private static final String LOG_PREFIX = "[Generator]";
    private static final int MORNING_END_HOUR = 12;
    private static final int AFTERNOON_END_HOUR = 18;
    private static final int NIGHT_END_HOUR = 5;
    private static final Set<String> DERIVED_KEYS = Set.of("timeOfDayGreeting", "messageType", "keywords", "topic");

    private final ResponseTemplateEngine templateEngine;
    private final ResponderProperties properties;
    private final Clock clock;

    public String generate(Classification classification, UserContext userContext, ResponsePattern pattern) {
        return generate(classification, userContext, pattern, List.of());
    }

    /**
     * @param pattern
     *            chosen pattern; null only for the generic urgency
     *            acknowledgment
     * @throws TemplateException
     *             if required context is missing
     */
    public String generate(Classification classification, UserContext userContext, ResponsePattern pattern,
            List<MessageOrigin> history) {
        ResponderProperties.GeneratorProperties config = properties.getGenerator();
        String template;
        if (pattern != null) {
            template = pattern.getTemplate();
        } else if (classification != null && classification.hasUrgencyMarkers()) {
            template = config.getUrgentAcknowledgment();
        } else {
            throw new TemplateException("No pattern selected for a non-urgent message", List.of());
        }

        Map<String, String> callerContext = callerContext(userContext);
        if (pattern != null && pattern.isRequiresContext()) {
            requireContext(pattern, template, callerContext);
        }

        Map<String, String> variables = new HashMap<>(derivedContext(classification));
        callerContext.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                variables.put(key, value);
            }
        });

        String response = templateEngine.render(template, variables);

        if (userContext != null && userContext.isPremium()) {
            response = config.getPremiumPrefix() + response;
        }
        if (history != null && history.size() > 1) {
            response = response + "\n\n" + config.getHistorySuffix();
        }
        if (classification != null && classification.hasUrgencyMarkers()) {
            response = config.getUrgencyPrefix() + response;
        }
        return response;
    }

    String timeOfDayGreeting() {
        ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), ZoneId.of(properties.getGenerator().getZoneId()));
        int hour = now.getHour();
        if (hour < NIGHT_END_HOUR) {
            return "Good evening";
        }
        if (hour < MORNING_END_HOUR) {
            return "Good morning";
        }
        if (hour < AFTERNOON_END_HOUR) {
            return "Good afternoon";
        }
        return "Good evening";
    }

    private void requireContext(ResponsePattern pattern, String template, Map<String, String> callerContext) {
        List<String> required = pattern.getRequiredContext() == null || pattern.getRequiredContext().isEmpty()
                ? templateEngine.placeholdersWithoutDefault(template).stream()
                        .filter(key -> !DERIVED_KEYS.contains(key))
                        .toList()
                : new ArrayList<>(pattern.getRequiredContext());
        List<String> missing = required.stream()
                .filter(key -> {
                    String value = callerContext.get(key);
                    return value == null || value.isBlank();
                })
                .toList();
        if (!missing.isEmpty()) {
            log.debug("{} Pattern '{}' requires missing context {}", LOG_PREFIX, pattern.getId(), missing);
            throw new TemplateException(
                    "Pattern '" + pattern.getId() + "' requires context that is not available: " + missing,
                    missing);
        }
    }

    private Map<String, String> callerContext(UserContext userContext) {
        Map<String, String> context = new HashMap<>();
        if (userContext == null) {
            return context;
        }
        if (userContext.getAttributes() != null) {
            context.putAll(userContext.getAttributes());
        }
        if (userContext.getFirstName() != null) {
            context.put("firstName", userContext.getFirstName());
        }
        if (userContext.getUserId() != null) {
            context.put("userId", userContext.getUserId());
        }
        return context;
    }

    private Map<String, String> derivedContext(Classification classification) {
        Map<String, String> derived = new HashMap<>();
        derived.put("timeOfDayGreeting", timeOfDayGreeting());
        if (classification == null) {
            return derived;
        }
        if (classification.getDetectedType() != null) {
            derived.put("messageType",
                    classification.getDetectedType().name().toLowerCase(Locale.ROOT).replace('_', ' '));
        }
        if (classification.getMatchedKeywords() != null && !classification.getMatchedKeywords().isEmpty()) {
            derived.put("keywords", String.join(", ", classification.getMatchedKeywords()));
            derived.put("topic", classification.getMatchedKeywords().iterator().next());
        }
        return derived;
    }
}
