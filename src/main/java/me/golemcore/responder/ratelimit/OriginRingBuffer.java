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

import me.golemcore.responder.domain.model.MessageOrigin;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring buffer of the last K message origins of a conversation.
 * Adding beyond capacity overwrites the oldest entry.
 *
 * <p>
 * Not thread-safe: callers hold the per-conversation stripe lock.
 */
public class OriginRingBuffer {

    private final MessageOrigin[] entries;
    private int next;
    private int size;
    private Instant lastTouched;

    public OriginRingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.entries = new MessageOrigin[capacity];
    }

    public void add(MessageOrigin origin) {
        entries[next] = origin;
        next = (next + 1) % entries.length;
        if (size < entries.length) {
            size++;
        }
    }

    /**
     * Entries oldest first.
     */
    public List<MessageOrigin> toList() {
        List<MessageOrigin> result = new ArrayList<>(size);
        int start = (next - size + entries.length) % entries.length;
        for (int i = 0; i < size; i++) {
            result.add(entries[(start + i) % entries.length]);
        }
        return result;
    }

    /**
     * Mark the buffer as used at {@code now}; idle buffers are evicted by the
     * guard.
     */
    public void touch(Instant now) {
        lastTouched = now;
    }

    public boolean isIdleSince(Instant cutoff) {
        return lastTouched == null || !lastTouched.isAfter(cutoff);
    }

    public int capacity() {
        return entries.length;
    }

    public int size() {
        return size;
    }
}
