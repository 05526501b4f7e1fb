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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one decision, appended to the stats log.
 *
 * <p>
 * Records are append-only. The only later mutation is a single feedback
 * attachment ({@code userAccepted}, {@code feedback}, {@code feedbackAt}),
 * enforced by the stats recorder.
 *
 * @since 1.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatRecord {

    private String id;

    /**
     * Pattern used for the response; null when the message was deferred or
     * answered with the generic urgency acknowledgment.
     */
    private String patternId;

    private String userId;
    private Instant timestamp;
    private boolean sent;
    private DecisionReason reason;

    private Boolean userAccepted;
    private String feedback;
    private Instant feedbackAt;

    // Truncated message/response text for later review
    private String messageContent;
    private String responseContent;

    public boolean hasFeedback() {
        return userAccepted != null;
    }
}
