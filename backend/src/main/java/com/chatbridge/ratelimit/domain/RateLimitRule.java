package com.chatbridge.ratelimit.domain;

import java.time.Duration;

/**
 * At most {@code limit} actions within any trailing {@code window}.
 */
public record RateLimitRule(int limit, Duration window) {

    public RateLimitRule {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public long windowNanos() {
        return window.toNanos();
    }
}
