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
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * In-memory {@link ResponseGuard} with per-user sliding windows and
 * per-conversation origin ring buffers.
 *
 * <p>
 * State is keyed by user id (rate) and conversation id (loop) in concurrent
 * maps. Mutations of one key are serialized through a striped set of
 * {@link ReentrantLock}s, so messages from the same user cannot race while
 * different users almost never contend. A lock that cannot be acquired within
 * {@code responder.guard.lock-timeout} surfaces as
 * {@link GuardUnavailableException}.
 *
 * <p>
 * Empty windows and conversation histories untouched for
 * {@code responder.guard.history-ttl} are evicted periodically by a background
 * thread.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SlidingWindowResponseGuard implements ResponseGuard {

    private static final String LOG_PREFIX = "[Guard]";
    private static final String USER_KEY_PREFIX = "user:";
    private static final String CONVERSATION_KEY_PREFIX = "conversation:";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final ResponderProperties properties;
    private final Clock clock;
    private final ReentrantLock[] stripes;

    private final Map<String, SlidingWindow> windows = new ConcurrentHashMap<>();
    private final Map<String, OriginRingBuffer> histories = new ConcurrentHashMap<>();

    private volatile boolean available = true;
    private ScheduledExecutorService evictionExecutor;

    public SlidingWindowResponseGuard(ResponderProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.stripes = new ReentrantLock[stripeCount(properties.getGuard().getLockStripes())];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @PostConstruct
    public void init() {
        long intervalMs = properties.getGuard().getEvictionInterval().toMillis();
        evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "guard-eviction");
            t.setDaemon(true);
            return t;
        });
        evictionExecutor.scheduleAtFixedRate(() -> evictExpired(clock.instant()),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void destroy() {
        available = false;
        if (evictionExecutor == null) {
            return;
        }
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean mayRespond(String userId, boolean premium, Instant now) {
        return checkRate(userId, premium, List.of(), now).isAllowed();
    }

    @Override
    public GuardCheck checkRate(String userId, boolean premium, List<Instant> knownResponses, Instant now) {
        if (premium) {
            return GuardCheck.allowed(0, Integer.MAX_VALUE);
        }
        String key = USER_KEY_PREFIX + userId;
        return withLock(key, () -> evaluateRate(key, userId, knownResponses, now));
    }

    @Override
    public void recordResponse(String userId, Instant now) {
        Duration window = properties.getGuard().getWindow();
        String key = USER_KEY_PREFIX + userId;
        withLock(key, () -> {
            windows.computeIfAbsent(key, k -> new SlidingWindow()).add(now, window);
            return null;
        });
    }

    @Override
    public GuardCheck recordResponseIfAllowed(String userId, boolean premium, List<Instant> knownResponses,
            Instant now) {
        Duration window = properties.getGuard().getWindow();
        String key = USER_KEY_PREFIX + userId;
        return withLock(key, () -> {
            GuardCheck check = premium
                    ? GuardCheck.allowed(0, Integer.MAX_VALUE)
                    : evaluateRate(key, userId, knownResponses, now);
            if (check.isAllowed()) {
                windows.computeIfAbsent(key, k -> new SlidingWindow()).add(now, window);
            }
            return check;
        });
    }

    /**
     * Caller holds the stripe lock of {@code key}.
     */
    private GuardCheck evaluateRate(String key, String userId, List<Instant> knownResponses, Instant now) {
        ResponderProperties.GuardProperties config = properties.getGuard();
        int limit = config.getMaxResponses();
        Duration window = config.getWindow();
        SlidingWindow tracked = windows.get(key);
        int trackedCount = tracked == null ? 0 : tracked.count(now, window);
        int suppliedCount = countWithinWindow(knownResponses, now, window);
        int count = Math.max(trackedCount, suppliedCount);
        if (count >= limit) {
            Duration wait = tracked == null ? window : tracked.timeUntilSlotFrees(now, window);
            log.debug("{} User {} rate limited ({}/{} within {})", LOG_PREFIX, userId, count, limit, window);
            return GuardCheck.rateLimited(count, limit, wait);
        }
        return GuardCheck.allowed(count, limit);
    }

    @Override
    public int recentAutoTypeStreak(List<MessageOrigin> history) {
        if (history == null || history.isEmpty()) {
            return 0;
        }
        int k = Math.max(1, properties.getGuard().getHistorySize());
        List<MessageOrigin> tail = history.size() > k ? history.subList(history.size() - k, history.size()) : history;
        int streak = 0;
        for (int i = tail.size() - 1; i >= 0; i--) {
            MessageOrigin origin = tail.get(i);
            if (origin == null || !origin.isMachineGenerated()) {
                break;
            }
            streak++;
        }
        return streak;
    }

    @Override
    public GuardCheck checkLoop(List<MessageOrigin> history) {
        ensureAvailable();
        int threshold = properties.getGuard().getLoopThreshold();
        int streak = recentAutoTypeStreak(history);
        if (streak >= threshold) {
            log.debug("{} Loop detected: {} consecutive automated replies (threshold {})",
                    LOG_PREFIX, streak, threshold);
            return GuardCheck.loopDetected(streak, threshold);
        }
        return GuardCheck.allowed(streak, threshold);
    }

    @Override
    public void recordOrigin(String conversationId, MessageOrigin origin) {
        int capacity = Math.max(1, properties.getGuard().getHistorySize());
        String key = CONVERSATION_KEY_PREFIX + conversationId;
        withLock(key, () -> {
            OriginRingBuffer buffer = histories.get(key);
            if (buffer == null || buffer.capacity() != capacity) {
                OriginRingBuffer resized = new OriginRingBuffer(capacity);
                if (buffer != null) {
                    buffer.toList().forEach(resized::add);
                }
                buffer = resized;
                histories.put(key, buffer);
            }
            buffer.add(origin);
            buffer.touch(clock.instant());
            return null;
        });
    }

    @Override
    public List<MessageOrigin> recentOrigins(String conversationId) {
        String key = CONVERSATION_KEY_PREFIX + conversationId;
        return withLock(key, () -> {
            OriginRingBuffer buffer = histories.get(key);
            return buffer == null ? List.of() : List.copyOf(buffer.toList());
        });
    }

    /**
     * Drop windows that no longer hold any in-window event and conversation
     * histories idle for longer than the history TTL.
     */
    void evictExpired(Instant now) {
        Duration window = properties.getGuard().getWindow();
        int evictedWindows = evictWhere(windows, key -> {
            SlidingWindow sliding = windows.get(key);
            return sliding != null && sliding.count(now, window) == 0;
        });

        Instant cutoff = now.minus(properties.getGuard().getHistoryTtl());
        int evictedHistories = evictWhere(histories, key -> {
            OriginRingBuffer buffer = histories.get(key);
            return buffer != null && buffer.isIdleSince(cutoff);
        });

        if (evictedWindows > 0 || evictedHistories > 0) {
            log.debug("{} Evicted {} idle rate windows and {} idle conversation histories", LOG_PREFIX,
                    evictedWindows, evictedHistories);
        }
    }

    private int evictWhere(Map<String, ?> state, Predicate<String> idle) {
        int evicted = 0;
        for (String key : state.keySet()) {
            try {
                boolean removed = withLock(key, () -> idle.test(key) && state.remove(key) != null);
                if (removed) {
                    evicted++;
                }
            } catch (GuardUnavailableException e) {
                log.debug("{} Skipping eviction of {}: {}", LOG_PREFIX, key, e.getMessage());
            }
        }
        return evicted;
    }

    int trackedUsers() {
        return windows.size();
    }

    int trackedConversations() {
        return histories.size();
    }

    private <T> T withLock(String key, Supplier<T> action) {
        ensureAvailable();
        ReentrantLock lock = stripeFor(key);
        long timeoutMs = properties.getGuard().getLockTimeout().toMillis();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GuardUnavailableException("Interrupted while waiting for guard state of " + key, e);
        }
        if (!acquired) {
            throw new GuardUnavailableException("Timed out waiting for guard state of " + key);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void ensureAvailable() {
        if (!available) {
            throw new GuardUnavailableException("Response guard is shut down");
        }
    }

    private ReentrantLock stripeFor(String key) {
        int h = key.hashCode();
        h ^= h >>> 16;
        return stripes[h & (stripes.length - 1)];
    }

    private static int countWithinWindow(List<Instant> timestamps, Instant now, Duration window) {
        if (timestamps == null || timestamps.isEmpty()) {
            return 0;
        }
        Instant cutoff = now.minus(window);
        int count = 0;
        for (Instant timestamp : timestamps) {
            if (timestamp != null && timestamp.isAfter(cutoff) && !timestamp.isAfter(now)) {
                count++;
            }
        }
        return count;
    }

    private static int stripeCount(int requested) {
        int n = 1;
        while (n < Math.max(1, requested)) {
            n <<= 1;
        }
        return n;
    }
}
