package com.chatbridge.room.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A named channel grouping users. Metadata is fixed at creation; membership
 * and last activity change concurrently and are exposed only as copies.
 */
@Getter
public class Room {

    private final String id;

    private final String name;

    private final RoomType type;

    private final String createdBy;

    private final Instant createdAt;

    private volatile Instant lastActivity;

    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> members = ConcurrentHashMap.newKeySet();

    @Builder
    public Room(String id, String name, RoomType type, String createdBy, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    /**
     * @return true if the user was not a member before
     */
    public boolean addMember(String userId) {
        return members.add(userId);
    }

    /**
     * @return true if the user was a member before
     */
    public boolean removeMember(String userId) {
        return members.remove(userId);
    }

    public boolean hasMember(String userId) {
        return members.contains(userId);
    }

    public Set<String> getMemberIds() {
        return Set.copyOf(members);
    }

    public int getMemberCount() {
        return members.size();
    }

    public void markActivity(Instant at) {
        // Activity only moves forward even if messages race on the timestamp
        synchronized (this) {
            if (at.isAfter(lastActivity)) {
                lastActivity = at;
            }
        }
    }
}
