package com.chatbridge.room.dto;

import com.chatbridge.room.domain.Room;
import com.chatbridge.room.domain.RoomType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;

@Getter
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RoomSummary {

    private final String roomId;

    private final String name;

    private final RoomType roomType;

    private final String createdBy;

    private final Instant createdAt;

    private final Instant lastActivity;

    private final int memberCount;

    private final Set<String> members;

    // Only set in per-user room lists; unread is omitted for rooms the user is not in
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Integer unreadCount;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final LastMessagePreview lastMessage;

    public static RoomSummary from(Room room) {
        Set<String> members = room.getMemberIds();
        return RoomSummary.builder()
                .roomId(room.getId())
                .name(room.getName())
                .roomType(room.getType())
                .createdBy(room.getCreatedBy())
                .createdAt(room.getCreatedAt())
                .lastActivity(room.getLastActivity())
                .memberCount(members.size())
                .members(members)
                .build();
    }
}
