package com.chatbridge.presence.domain;

import java.time.Instant;

/**
 * Immutable presence fact for one user. Replaced wholesale on every change,
 * so readers never observe a half-applied transition.
 */
public record PresenceState(boolean online, String connectionId, Instant lastSeen) {

    public static PresenceState online(String connectionId, Instant now) {
        return new PresenceState(true, connectionId, now);
    }

    public static PresenceState offline(Instant now) {
        return new PresenceState(false, null, now);
    }

    public PresenceState seenAt(Instant now) {
        return new PresenceState(online, connectionId, now);
    }
}
