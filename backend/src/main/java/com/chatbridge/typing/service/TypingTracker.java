package com.chatbridge.typing.service;

import com.chatbridge.common.time.MonotonicClock;
import com.chatbridge.exception.NotRoomMemberException;
import com.chatbridge.room.service.RoomDirectory;
import com.chatbridge.typing.domain.TypingIndicator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Typing indicators with lazy expiry.
 *
 * Expired indicators are filtered out when read instead of being swept by a
 * timer; the map holds at most one entry per user, so it stays as small as
 * the number of concurrent typists.
 */
@Slf4j
@Service
public class TypingTracker {

    // One indicator per user: starting to type elsewhere supersedes it
    private final ConcurrentHashMap<String, TypingIndicator> indicators = new ConcurrentHashMap<>();
    private final RoomDirectory roomDirectory;
    private final MonotonicClock clock;
    private final long timeoutNanos;

    public TypingTracker(RoomDirectory roomDirectory,
                         MonotonicClock clock,
                         @Value("${chat.typing.timeout-seconds:5}") long timeoutSeconds) {
        this.roomDirectory = roomDirectory;
        this.clock = clock;
        this.timeoutNanos = Duration.ofSeconds(timeoutSeconds).toNanos();
    }

    public void setTyping(String userId, String roomId) {
        if (!roomDirectory.isMember(userId, roomId)) {
            throw new NotRoomMemberException("User is not a member of this room");
        }
        indicators.put(userId, new TypingIndicator(userId, roomId, clock.nanoTime()));
    }

    /**
     * @return true if an indicator for this room was removed
     */
    public boolean clearTyping(String userId, String roomId) {
        boolean[] removed = {false};
        indicators.computeIfPresent(userId, (id, indicator) -> {
            if (indicator.roomId().equals(roomId)) {
                removed[0] = true;
                return null;
            }
            return indicator;
        });
        return removed[0];
    }

    public void clearUser(String userId) {
        if (indicators.remove(userId) != null) {
            log.debug("Cleared typing indicator: userId={}", userId);
        }
    }

    /**
     * Users typing in the room as of now. Indicators of users who have since
     * left the room are skipped, so a late refresh racing a leave never shows.
     */
    public List<String> listTyping(String roomId) {
        long now = clock.nanoTime();
        return indicators.values().stream()
                .filter(indicator -> indicator.roomId().equals(roomId))
                .filter(indicator -> indicator.isLiveAt(now, timeoutNanos))
                .map(TypingIndicator::userId)
                .filter(userId -> roomDirectory.isMember(userId, roomId))
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Room the user is typing in now. Like {@link #listTyping(String)}, an
     * indicator for a room the user has since left does not count.
     */
    public Optional<String> typingRoomOf(String userId) {
        TypingIndicator indicator = indicators.get(userId);
        if (indicator == null || !indicator.isLiveAt(clock.nanoTime(), timeoutNanos)) {
            return Optional.empty();
        }
        return Optional.of(indicator.roomId())
                .filter(roomId -> roomDirectory.isMember(userId, roomId));
    }
}
