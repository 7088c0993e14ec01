package com.chatbridge.exception;

import com.chatbridge.ratelimit.domain.RateCategory;

import java.time.Duration;

/**
 * Thrown when a sliding window is full. Expected and frequent under load,
 * so callers log it at debug level only.
 */
public class RateLimitedException extends ChatException {

    private final RateCategory category;
    private final Duration retryAfter;

    public RateLimitedException(RateCategory category, Duration retryAfter) {
        super(ChatErrorCode.RATE_LIMITED, String.format(
                "Too many %s requests, retry after %d seconds",
                category.getLabel(), Math.max(1, (retryAfter.toMillis() + 999) / 1000)));
        this.category = category;
        this.retryAfter = retryAfter;
    }

    public RateCategory getCategory() {
        return category;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
