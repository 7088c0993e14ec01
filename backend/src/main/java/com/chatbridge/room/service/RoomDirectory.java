package com.chatbridge.room.service;

import com.chatbridge.exception.InvalidNameException;
import com.chatbridge.exception.NotRoomMemberException;
import com.chatbridge.exception.RoomNotFoundException;
import com.chatbridge.room.domain.Room;
import com.chatbridge.room.domain.RoomType;
import com.chatbridge.room.dto.RoomSummary;
import com.chatbridge.user.service.UserRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Rooms and their membership sets.
 *
 * Rooms are never removed, so a room reference obtained from the map stays
 * valid; membership changes go through the room's concurrent set and are
 * atomic per (room, user).
 */
@Slf4j
@Service
public class RoomDirectory {

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final UserRegistry userRegistry;
    private final Clock clock;
    private final int maxNameLength;

    public RoomDirectory(UserRegistry userRegistry,
                         Clock clock,
                         @Value("${chat.room.max-name-length:100}") int maxNameLength) {
        this.userRegistry = userRegistry;
        this.clock = clock;
        this.maxNameLength = maxNameLength;
    }

    public Room createRoom(String name, RoomType type, String creatorId) {
        return createRoom(name, type, creatorId, List.of());
    }

    /**
     * Creates a room with the creator auto-joined. Names need not be unique.
     * All ids are validated before anything is stored.
     */
    public Room createRoom(String name, RoomType type, String creatorId, Collection<String> initialMemberIds) {
        if (name == null || name.isBlank() || name.codePointCount(0, name.length()) > maxNameLength) {
            throw new InvalidNameException(
                    "Room name must be between 1 and " + maxNameLength + " characters");
        }
        userRegistry.require(creatorId);
        for (String memberId : initialMemberIds) {
            userRegistry.require(memberId);
        }

        Room room = Room.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .type(type != null ? type : RoomType.PUBLIC)
                .createdBy(creatorId)
                .createdAt(clock.instant())
                .build();
        room.addMember(creatorId);
        initialMemberIds.forEach(room::addMember);
        rooms.put(room.getId(), room);

        log.info("Room created: roomId={}, name={}, type={}, creator={}",
                room.getId(), room.getName(), room.getType(), creatorId);
        return room;
    }

    /**
     * Joins a public room. Private rooms only admit the members they were
     * created with, so a join there succeeds only as a no-op for a member.
     *
     * @return true if the user was newly added, false if already a member
     * @throws NotRoomMemberException if the room is private and the user is not in it
     */
    public boolean join(String userId, String roomId) {
        Room room = requireRoom(roomId);
        userRegistry.require(userId);
        if (room.getType() == RoomType.PRIVATE && !room.hasMember(userId)) {
            throw new NotRoomMemberException("Private room is open to its members only");
        }
        boolean added = room.addMember(userId);
        if (added) {
            log.debug("User joined room: userId={}, roomId={}", userId, roomId);
        }
        return added;
    }

    /**
     * @return true if the user was a member and has been removed
     */
    public boolean leave(String userId, String roomId) {
        Room room = requireRoom(roomId);
        boolean removed = room.removeMember(userId);
        if (removed) {
            log.debug("User left room: userId={}, roomId={}", userId, roomId);
        }
        return removed;
    }

    public boolean isMember(String userId, String roomId) {
        if (userId == null || roomId == null) {
            return false;
        }
        Room room = rooms.get(roomId);
        return room != null && room.hasMember(userId);
    }

    public boolean exists(String roomId) {
        return roomId != null && rooms.containsKey(roomId);
    }

    public Optional<Room> getRoom(String roomId) {
        return roomId == null ? Optional.empty() : Optional.ofNullable(rooms.get(roomId));
    }

    public Room requireRoom(String roomId) {
        return getRoom(roomId)
                .orElseThrow(() -> new RoomNotFoundException("Room not found: " + roomId));
    }

    public Set<String> members(String roomId) {
        return requireRoom(roomId).getMemberIds();
    }

    public void touchActivity(String roomId) {
        requireRoom(roomId).markActivity(clock.instant());
    }

    public List<RoomSummary> listRooms() {
        return rooms.values().stream()
                .sorted(Comparator.comparing(Room::getCreatedAt).thenComparing(Room::getId))
                .map(RoomSummary::from)
                .collect(Collectors.toList());
    }

    /**
     * Public rooms plus the private rooms the user belongs to.
     */
    public List<RoomSummary> listVisibleRooms(String userId) {
        return rooms.values().stream()
                .filter(room -> room.getType() == RoomType.PUBLIC || room.hasMember(userId))
                .sorted(Comparator.comparing(Room::getCreatedAt).thenComparing(Room::getId))
                .map(RoomSummary::from)
                .collect(Collectors.toList());
    }

    public int roomCount() {
        return rooms.size();
    }
}
