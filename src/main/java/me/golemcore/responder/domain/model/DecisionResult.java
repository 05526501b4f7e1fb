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

import lombok.Builder;
import lombok.Data;

/**
 * Final accept/defer verdict for one classified message.
 *
 * <p>
 * When {@code shouldRespond} is false the caller defers to the external text
 * generator. {@code urgentAcknowledgment} marks a response without a matched
 * pattern that should use the generic urgency template.
 *
 * @since 1.0
 */
@Data
@Builder
public class DecisionResult {

    private boolean shouldRespond;
    private ResponsePriority priority;
    private DecisionReason reason;
    private String matchedPatternId;

    @Builder.Default
    private boolean urgentAcknowledgment = false;

    public static DecisionResult respond(ResponsePriority priority, DecisionReason reason, String patternId) {
        return DecisionResult.builder()
                .shouldRespond(true)
                .priority(priority)
                .reason(reason)
                .matchedPatternId(patternId)
                .build();
    }

    public static DecisionResult acknowledgeUrgent() {
        return DecisionResult.builder()
                .shouldRespond(true)
                .priority(ResponsePriority.IMMEDIATE)
                .reason(DecisionReason.URGENT)
                .urgentAcknowledgment(true)
                .build();
    }

    public static DecisionResult defer(DecisionReason reason, String patternId) {
        return DecisionResult.builder()
                .shouldRespond(false)
                .reason(reason)
                .matchedPatternId(patternId)
                .build();
    }

    public String describe() {
        return reason != null ? reason.getDescription() : "";
    }
}
