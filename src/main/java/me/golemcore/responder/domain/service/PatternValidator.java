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

import me.golemcore.responder.domain.exception.PatternValidationException;
import me.golemcore.responder.domain.model.CompiledPattern;
import me.golemcore.responder.domain.model.ResponsePattern;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates a pattern and compiles it into its immutable snapshot form.
 *
 * <p>
 * Checks:
 * <ul>
 * <li>id, trigger, message type, priority and template are present</li>
 * <li>the trigger compiles as a regular expression</li>
 * <li>{@code minConfidence} and {@code baseConfidence} lie in [0, 1]</li>
 * </ul>
 * The input is copied before compilation, so later edits to the caller's
 * object never leak into a snapshot.
 */
@Component
public class PatternValidator {

    private static final int TRIGGER_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public CompiledPattern compile(ResponsePattern pattern) {
        if (pattern == null) {
            throw new PatternValidationException(null, "Pattern is required");
        }
        String id = pattern.getId();
        if (id == null || id.isBlank()) {
            throw new PatternValidationException(id, "Pattern id is required");
        }
        if (pattern.getTrigger() == null || pattern.getTrigger().isEmpty()) {
            throw new PatternValidationException(id, "Pattern '" + id + "' has no trigger");
        }
        if (pattern.getMessageType() == null) {
            throw new PatternValidationException(id, "Pattern '" + id + "' has no message type");
        }
        if (pattern.getPriority() == null) {
            throw new PatternValidationException(id, "Pattern '" + id + "' has no priority");
        }
        if (pattern.getTemplate() == null || pattern.getTemplate().isBlank()) {
            throw new PatternValidationException(id, "Pattern '" + id + "' has no response template");
        }
        requireUnitInterval(id, "minConfidence", pattern.getMinConfidence());
        if (pattern.getBaseConfidence() != null) {
            requireUnitInterval(id, "baseConfidence", pattern.getBaseConfidence());
        }

        Pattern trigger;
        try {
            trigger = Pattern.compile(pattern.getTrigger(), TRIGGER_FLAGS);
        } catch (PatternSyntaxException e) {
            throw new PatternValidationException(id,
                    "Pattern '" + id + "' has an invalid trigger: " + e.getDescription(), e);
        }
        return new CompiledPattern(pattern.copy(), trigger);
    }

    private void requireUnitInterval(String id, String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new PatternValidationException(id,
                    "Pattern '" + id + "' " + field + " must be within [0, 1], got " + value);
        }
    }
}
