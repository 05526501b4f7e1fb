package me.golemcore.responder.domain.model;

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

/**
 * Closed set of reason codes attached to every {@link DecisionResult}.
 */
public enum DecisionReason {

    PATTERN_MATCHED("Confident pattern match"),
    URGENT("Urgency markers detected"),
    LOW_CONFIDENCE("No confident pattern match"),
    RATE_LIMITED("Automatic response limit reached for user"),
    LOOP_DETECTED("Too many consecutive automated replies"),
    GUARD_UNAVAILABLE("Rate guard unavailable"),
    INVALID_INPUT("Message rejected before classification"),
    MISSING_CONTEXT("Response template needs context the caller did not supply");

    private final String description;

    DecisionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
