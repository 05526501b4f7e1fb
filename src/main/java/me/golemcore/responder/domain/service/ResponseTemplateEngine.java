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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template engine for canned responses. Substitutes {@code {{name}}}
 * placeholders with values from a variable map; {@code {{name|fallback}}}
 * supplies a default used when the variable is missing or blank.
 *
 * <p>
 * Rendering is strict: a placeholder without value and without default fails
 * the whole render with {@link TemplateException}, so a partially rendered
 * string is never produced.
 */
@Component
public class ResponseTemplateEngine {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{\\s*(\\w+)\\s*(?:\\|([^}]*))?}}");

    /**
     * Renders content by substituting placeholders.
     *
     * @param content
     *            the template content
     * @param variables
     *            the variable name-to-value mapping
     * @return the rendered content
     * @throws TemplateException
     *             if any placeholder has neither a value nor a default
     */
    public String render(String content, Map<String, String> variables) {
        if (content == null) {
            throw new TemplateException("Template is missing", List.of());
        }
        Map<String, String> values = variables == null ? Map.of() : variables;

        Matcher matcher = VARIABLE_PATTERN.matcher(content);
        StringBuilder result = new StringBuilder();
        Set<String> missing = new LinkedHashSet<>();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String fallback = matcher.group(2);
            String value = values.get(varName);
            if (value == null || value.isBlank()) {
                value = fallback != null ? fallback.trim() : null;
            }
            if (value == null) {
                missing.add(varName);
                continue;
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        if (!missing.isEmpty()) {
            throw new TemplateException("Template references unavailable context: " + missing,
                    new ArrayList<>(missing));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Placeholder names referenced by the template, in order of first use.
     */
    public List<String> placeholders(String content) {
        if (content == null) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(content);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return new ArrayList<>(names);
    }

    /**
     * Placeholder names used at least once without a {@code |default}, in
     * order of first use.
     */
    public List<String> placeholdersWithoutDefault(String content) {
        if (content == null) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(content);
        while (matcher.find()) {
            if (matcher.group(2) == null) {
                names.add(matcher.group(1));
            }
        }
        return new ArrayList<>(names);
    }
}
