package me.golemcore.responder.ratelimit;

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

import me.golemcore.responder.domain.exception.GuardUnavailableException;
import me.golemcore.responder.domain.model.GuardCheck;
import me.golemcore.responder.domain.model.MessageOrigin;

import java.time.Instant;
import java.util.List;

/**
 * Rate and loop guard for automatic responses.
 *
 * <p>
 * Two independent checks:
 * <ul>
 * <li>Rate - regular users get at most N automatic responses within a rolling
 * window W; premium users are unlimited</li>
 * <li>Loop - a conversation whose most recent messages are a run of automatic
 * or externally generated replies gets no further automatic reply</li>
 * </ul>
 *
 * <p>
 * Every method may throw {@link GuardUnavailableException} when per-user state
 * cannot be accessed; callers must fail safe and not respond.
 *
 * @since 1.0
 * @see SlidingWindowResponseGuard
 */
public interface ResponseGuard {

    /**
     * Whether another automatic response may be sent to the user now.
     */
    boolean mayRespond(String userId, boolean premium, Instant now);

    /**
     * Rate check that also counts caller-supplied response timestamps. The
     * effective count is the larger of the tracked and the supplied count.
     */
    GuardCheck checkRate(String userId, boolean premium, List<Instant> knownResponses, Instant now);

    /**
     * Record an automatic response actually sent. Must be called exactly once
     * per send, never for responses that were only considered.
     */
    void recordResponse(String userId, Instant now);

    /**
     * Rate check and record in one step: the response is counted only when the
     * check allows it. Used right before sending, so that two concurrent
     * messages of one user cannot both take the last slot that
     * {@link #checkRate} reported free.
     */
    GuardCheck recordResponseIfAllowed(String userId, boolean premium, List<Instant> knownResponses, Instant now);

    /**
     * Number of consecutive machine-generated entries at the tail of the last K
     * history entries.
     *
     * @param history
     *            message origins, oldest first
     */
    int recentAutoTypeStreak(List<MessageOrigin> history);

    GuardCheck checkLoop(List<MessageOrigin> history);

    void recordOrigin(String conversationId, MessageOrigin origin);

    /**
     * Tracked origins of a conversation, oldest first.
     */
    List<MessageOrigin> recentOrigins(String conversationId);
}
