package com.chatbridge.websocket.dto;

import com.chatbridge.message.domain.ChatMessage;
import com.chatbridge.message.domain.MessageType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessagePayload {
    private final String messageId;
    private final String roomId;
    private final String senderId;
    private final String senderName;
    private final String content;
    private final MessageType messageType;
    private final Instant timestamp;
    private final Set<String> deliveredTo;
    private final Set<String> readBy;

    public static MessagePayload from(ChatMessage message, String senderName) {
        return MessagePayload.builder()
                .messageId(message.getMessageId())
                .roomId(message.getRoomId())
                .senderId(message.getSenderId())
                .senderName(senderName)
                .content(message.getContent())
                .messageType(message.getMessageType())
                .timestamp(message.getCreatedAt())
                .deliveredTo(new TreeSet<>(message.getDeliveredTo()))
                .readBy(new TreeSet<>(message.getReadBy()))
                .build();
    }
}
