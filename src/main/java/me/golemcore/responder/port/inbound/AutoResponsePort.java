package me.golemcore.responder.port.inbound;

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

import me.golemcore.responder.domain.model.AutoResponseOutcome;
import me.golemcore.responder.domain.model.Classification;
import me.golemcore.responder.domain.model.DecisionResult;
import me.golemcore.responder.domain.model.MessageOrigin;
import me.golemcore.responder.domain.model.ResponderResult;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.domain.model.StatRecord;
import me.golemcore.responder.domain.model.UserContext;

import java.util.List;

/**
 * Inbound port used by message handlers (webhooks, channel adapters) to decide
 * whether an inbound message gets an automatic reply.
 *
 * <p>
 * No method throws: every failure is reported as a
 * {@link ResponderResult#failure} and callers treat any failure as "defer to
 * the external generator".
 *
 * <p>
 * Conversation history lists are ordered oldest first; the last element is the
 * most recent message before the one being handled.
 *
 * @since 1.0
 */
public interface AutoResponsePort {

    ResponderResult<Classification> classify(String text);

    /**
     * Classify raw UTF-8 bytes. Byte sequences that are not valid UTF-8 are
     * rejected as invalid input.
     */
    ResponderResult<Classification> classify(byte[] utf8Text);

    ResponderResult<DecisionResult> decide(Classification classification, UserContext userContext,
            List<MessageOrigin> history);

    ResponderResult<String> generate(Classification classification, UserContext userContext,
            ResponsePattern pattern);

    /**
     * Queue an outcome record. Returns the record id immediately; persistence
     * happens in the background.
     */
    ResponderResult<String> record(StatRecord outcome);

    /**
     * Attach user feedback to a recorded outcome. Fails with
     * {@code NOT_FOUND} for unknown ids and {@code VALIDATION} when feedback was
     * already attached.
     */
    ResponderResult<StatRecord> attachFeedback(String recordId, boolean accepted, String note);

    /**
     * Run classify, decide, generate and record for one message.
     *
     * @param history
     *            prior message origins, or null to use the tracked history of
     *            the conversation
     */
    AutoResponseOutcome handle(String text, UserContext userContext, List<MessageOrigin> history);

    /**
     * Record the origin of a message that did not go through
     * {@link #handle}, e.g. a reply from the external generator.
     */
    void recordOrigin(String conversationId, MessageOrigin origin);
}
