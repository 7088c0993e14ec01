package com.chatbridge.websocket.dto;

import com.chatbridge.room.dto.RoomSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RoomListPayload {
    private final List<RoomSummary> rooms;
}
