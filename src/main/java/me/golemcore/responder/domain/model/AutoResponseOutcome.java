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
 * Full result of running one message through classify, decide, generate and
 * record. When {@code response} is null the caller must defer to the external
 * generator.
 *
 * @since 1.0
 */
@Data
@Builder
public class AutoResponseOutcome {

    private Classification classification;
    private DecisionResult decision;
    private String response;
    private String statRecordId;

    /**
     * Set when a step failed and the message was deferred because of it.
     */
    private ResponderFailureKind failureKind;
    private String error;

    public boolean isResponded() {
        return response != null;
    }

    public boolean isDeferred() {
        return response == null;
    }
}
