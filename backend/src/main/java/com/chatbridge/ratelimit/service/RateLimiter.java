package com.chatbridge.ratelimit.service;

import com.chatbridge.common.time.MonotonicClock;
import com.chatbridge.exception.RateLimitedException;
import com.chatbridge.ratelimit.domain.RateCategory;
import com.chatbridge.ratelimit.domain.RateLimitRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window-log rate limiter keyed by {@code category:userId}.
 *
 * Every access to a window happens inside {@link ConcurrentHashMap#compute},
 * which makes prune-check-record a single atomic unit per key. Two overlapping
 * requests of the same user can never both take the last free slot.
 */
@Slf4j
@Service
public class RateLimiter {

    private final MonotonicClock clock;
    private final Map<RateCategory, RateLimitRule> rules = new EnumMap<>(RateCategory.class);
    private final ConcurrentHashMap<String, SlidingWindowLog> windows = new ConcurrentHashMap<>();

    public RateLimiter(
            MonotonicClock clock,
            @Value("${chat.rate-limit.messages.limit:10}") int messageLimit,
            @Value("${chat.rate-limit.messages.window-seconds:60}") long messageWindowSeconds,
            @Value("${chat.rate-limit.connections.limit:5}") int connectionLimit,
            @Value("${chat.rate-limit.connections.window-seconds:60}") long connectionWindowSeconds) {
        this.clock = clock;
        rules.put(RateCategory.MESSAGE, new RateLimitRule(messageLimit, Duration.ofSeconds(messageWindowSeconds)));
        rules.put(RateCategory.CONNECTION, new RateLimitRule(connectionLimit, Duration.ofSeconds(connectionWindowSeconds)));
    }

    /**
     * Records one action for the user if the window has room for it.
     *
     * @throws RateLimitedException if the window already holds {@code limit} entries;
     *                              nothing is recorded in that case
     */
    public void admit(String userId, RateCategory category) {
        RateLimitRule rule = ruleFor(category);
        long now = clock.nanoTime();
        long[] retryAfterNanos = {-1L};

        windows.compute(buildKey(userId, category), (key, window) -> {
            SlidingWindowLog current = window != null ? window : new SlidingWindowLog();
            retryAfterNanos[0] = current.tryAcquire(now, rule);
            return current;
        });

        if (retryAfterNanos[0] >= 0) {
            log.debug("Rate limited: userId={}, category={}", userId, category);
            throw new RateLimitedException(category, Duration.ofNanos(retryAfterNanos[0]));
        }
    }

    /**
     * @return how many more actions the user may perform right now
     */
    public int remaining(String userId, RateCategory category) {
        RateLimitRule rule = ruleFor(category);
        long now = clock.nanoTime();
        int[] used = {0};
        windows.computeIfPresent(buildKey(userId, category), (key, window) -> {
            window.prune(now, rule.windowNanos());
            used[0] = window.size();
            return window;
        });
        return Math.max(0, rule.limit() - used[0]);
    }

    public RateLimitRule ruleFor(RateCategory category) {
        return rules.get(category);
    }

    /**
     * Drops windows whose entries have all aged out so idle users do not
     * accumulate. Removal happens inside compute, atomically with admission.
     */
    @Scheduled(fixedDelayString = "${chat.rate-limit.eviction-interval-ms:30000}")
    public void evictIdleWindows() {
        long now = clock.nanoTime();
        int before = windows.size();
        for (String key : windows.keySet()) {
            RateLimitRule rule = ruleFor(categoryOf(key));
            windows.computeIfPresent(key, (k, window) -> {
                window.prune(now, rule.windowNanos());
                return window.isEmpty() ? null : window;
            });
        }
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate windows", evicted);
        }
    }

    int trackedWindows() {
        return windows.size();
    }

    private String buildKey(String userId, RateCategory category) {
        return category.name() + ":" + userId;
    }

    private RateCategory categoryOf(String key) {
        return RateCategory.valueOf(key.substring(0, key.indexOf(':')));
    }

    /**
     * Monotonic ticks of recent admissions, oldest first.
     * Not thread-safe on its own; guarded by the owning map's compute.
     */
    static final class SlidingWindowLog {

        private final Deque<Long> ticks = new ArrayDeque<>();

        void prune(long now, long windowNanos) {
            while (!ticks.isEmpty() && now - ticks.peekFirst() >= windowNanos) {
                ticks.pollFirst();
            }
        }

        /**
         * @return -1 when admitted, otherwise nanos until the oldest entry leaves the window
         */
        long tryAcquire(long now, RateLimitRule rule) {
            long windowNanos = rule.windowNanos();
            prune(now, windowNanos);
            if (ticks.size() < rule.limit()) {
                ticks.addLast(now);
                return -1L;
            }
            return Math.max(0L, windowNanos - (now - ticks.peekFirst()));
        }

        int size() {
            return ticks.size();
        }

        boolean isEmpty() {
            return ticks.isEmpty();
        }
    }
}
