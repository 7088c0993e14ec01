package com.chatbridge.websocket.dto;

import com.chatbridge.exception.ChatErrorCode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorPayload {
    private final String message;
    private final ChatErrorCode code;
}
