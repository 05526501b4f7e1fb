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

import java.time.Duration;

/**
 * Result of a rate/loop guard check.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether another automatic response may be sent</li>
 * <li>{@code reason} - {@link DecisionReason#RATE_LIMITED} or
 * {@link DecisionReason#LOOP_DETECTED} when denied</li>
 * <li>{@code recentCount} / {@code limit} - window occupancy</li>
 * <li>{@code waitTime} - when rate limited, time until the oldest response
 * leaves the window</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class GuardCheck {

    private boolean allowed;
    private DecisionReason reason;
    private int recentCount;
    private int limit;
    private Duration waitTime;

    public static GuardCheck allowed(int recentCount, int limit) {
        return GuardCheck.builder()
                .allowed(true)
                .recentCount(recentCount)
                .limit(limit)
                .build();
    }

    public static GuardCheck rateLimited(int recentCount, int limit, Duration waitTime) {
        return GuardCheck.builder()
                .allowed(false)
                .reason(DecisionReason.RATE_LIMITED)
                .recentCount(recentCount)
                .limit(limit)
                .waitTime(waitTime)
                .build();
    }

    public static GuardCheck loopDetected(int streak, int threshold) {
        return GuardCheck.builder()
                .allowed(false)
                .reason(DecisionReason.LOOP_DETECTED)
                .recentCount(streak)
                .limit(threshold)
                .build();
    }
}
