package com.chatbridge.room.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LastMessagePreview {

    private final String messageId;

    private final String content;

    private final String senderId;

    private final String sender;

    private final Instant sentAt;
}
