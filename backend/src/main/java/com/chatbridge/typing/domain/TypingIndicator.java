package com.chatbridge.typing.domain;

/**
 * "User X is typing in room Y as of tick T". A user has at most one.
 */
public record TypingIndicator(String userId, String roomId, long tickNanos) {

    public boolean isLiveAt(long nowNanos, long timeoutNanos) {
        return nowNanos - tickNanos < timeoutNanos;
    }
}
