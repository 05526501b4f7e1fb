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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Timestamps of recent events kept in arrival order.
 *
 * <p>
 * An event at {@code t} is inside the window ending at {@code now} when
 * {@code t > now - window}. Expired entries are dropped lazily whenever the
 * window is read or written.
 *
 * <p>
 * Not thread-safe: callers hold the per-user stripe lock.
 */
public class SlidingWindow {

    private final Deque<Instant> events = new ArrayDeque<>();

    public void add(Instant timestamp, Duration window) {
        prune(timestamp, window);
        events.addLast(timestamp);
    }

    public int count(Instant now, Duration window) {
        prune(now, window);
        Instant cutoff = now.minus(window);
        int count = 0;
        for (Instant event : events) {
            if (event.isAfter(cutoff) && !event.isAfter(now)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Time until the oldest in-window event expires, or zero if the window is
     * empty.
     */
    public Duration timeUntilSlotFrees(Instant now, Duration window) {
        prune(now, window);
        Instant oldest = events.peekFirst();
        if (oldest == null) {
            return Duration.ZERO;
        }
        Duration wait = Duration.between(now, oldest.plus(window));
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    void prune(Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        while (!events.isEmpty() && !events.peekFirst().isAfter(cutoff)) {
            events.pollFirst();
        }
    }
}
