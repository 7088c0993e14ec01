package com.chatbridge.presence.service;

import com.chatbridge.exception.UnknownUserException;
import com.chatbridge.presence.domain.PresenceState;
import com.chatbridge.typing.service.TypingTracker;
import com.chatbridge.user.domain.ChatUser;
import com.chatbridge.user.dto.UserPresence;
import com.chatbridge.user.service.UserRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Tracks which users are online and through which connection.
 *
 * Each user's {@link PresenceState} is swapped atomically per key, and every
 * read hands out copies, never the live map.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceRegistry {

    private final ConcurrentHashMap<String, PresenceState> presence = new ConcurrentHashMap<>();
    private final UserRegistry userRegistry;
    private final TypingTracker typingTracker;
    private final Clock clock;

    /**
     * Marks the user online on the given connection.
     *
     * @return the connection the user was previously online on, if any
     * @throws UnknownUserException if the identity was never established
     */
    public Optional<String> setOnline(String userId, String connectionId) {
        userRegistry.require(userId);
        PresenceState previous = presence.put(userId, PresenceState.online(connectionId, clock.instant()));
        log.info("User online: userId={}, connectionId={}", userId, connectionId);

        if (previous != null && previous.online() && !previous.connectionId().equals(connectionId)) {
            return Optional.of(previous.connectionId());
        }
        return Optional.empty();
    }

    /**
     * Marks the user offline and clears the connection handle and any typing
     * indicator. Idempotent.
     */
    public void setOffline(String userId) {
        userRegistry.require(userId);
        presence.put(userId, PresenceState.offline(clock.instant()));
        typingTracker.clearUser(userId);
        log.info("User offline: userId={}", userId);
    }

    /**
     * Takes the user offline only if {@code connectionId} is still the user's
     * active connection. A stale connection of a user who already reconnected
     * elsewhere leaves presence untouched.
     *
     * @return true if the user went offline
     */
    public boolean releaseConnection(String userId, String connectionId) {
        userRegistry.require(userId);
        boolean[] released = {false};
        presence.computeIfPresent(userId, (id, state) -> {
            if (state.online() && connectionId.equals(state.connectionId())) {
                released[0] = true;
                return PresenceState.offline(clock.instant());
            }
            return state;
        });

        if (released[0]) {
            typingTracker.clearUser(userId);
            log.info("User offline: userId={}, connectionId={}", userId, connectionId);
        } else {
            log.debug("Stale connection released without presence change: userId={}, connectionId={}",
                    userId, connectionId);
        }
        return released[0];
    }

    /**
     * Heartbeat: refreshes last-seen only.
     */
    public void touch(String userId) {
        userRegistry.require(userId);
        presence.compute(userId, (id, state) -> state == null
                ? PresenceState.offline(clock.instant())
                : state.seenAt(clock.instant()));
    }

    public boolean isOnline(String userId) {
        PresenceState state = userId == null ? null : presence.get(userId);
        return state != null && state.online();
    }

    public Optional<String> connectionOf(String userId) {
        PresenceState state = userId == null ? null : presence.get(userId);
        if (state == null || !state.online()) {
            return Optional.empty();
        }
        return Optional.of(state.connectionId());
    }

    /**
     * @return handles of every online user, the "broadcast to all" audience
     */
    public Set<String> onlineConnections() {
        return presence.values().stream()
                .filter(PresenceState::online)
                .map(PresenceState::connectionId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Optional<UserPresence> get(String userId) {
        return userRegistry.find(userId)
                .map(user -> toSnapshot(user, presence.get(userId)));
    }

    public List<UserPresence> listOnline() {
        return presence.entrySet().stream()
                .filter(entry -> entry.getValue().online())
                .map(entry -> userRegistry.find(entry.getKey())
                        .map(user -> toSnapshot(user, entry.getValue()))
                        .orElse(null))
                .filter(snapshot -> snapshot != null)
                .sorted(Comparator.comparing(UserPresence::getUserId))
                .collect(Collectors.toList());
    }

    /**
     * Every known user with their presence, online or not.
     */
    public List<UserPresence> listAll() {
        return snapshotsOf(userRegistry.listUsers());
    }

    public List<UserPresence> search(String query) {
        return snapshotsOf(userRegistry.search(query));
    }

    public int onlineCount() {
        return (int) presence.values().stream().filter(PresenceState::online).count();
    }

    private List<UserPresence> snapshotsOf(List<ChatUser> users) {
        return users.stream()
                .map(user -> toSnapshot(user, presence.get(user.getUserId())))
                .collect(Collectors.toList());
    }

    private UserPresence toSnapshot(ChatUser user, PresenceState state) {
        boolean online = state != null && state.online();
        return UserPresence.builder()
                .userId(user.getUserId())
                .username(user.getDisplayName())
                .online(online)
                .lastSeen(state != null ? state.lastSeen() : user.getCreatedAt())
                .connectionId(online ? state.connectionId() : null)
                .typingIn(typingTracker.typingRoomOf(user.getUserId()).orElse(null))
                .build();
    }
}
