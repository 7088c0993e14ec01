package com.chatbridge.readreceipt.dto;

import com.chatbridge.message.domain.ChatMessage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.util.Set;
import java.util.TreeSet;

/**
 * Point-in-time copy of a message's receipt sets.
 */
@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageReceipts {

    private final String messageId;
    private final String roomId;
    private final Set<String> deliveredTo;
    private final Set<String> readBy;

    public static MessageReceipts from(ChatMessage message) {
        return MessageReceipts.builder()
                .messageId(message.getMessageId())
                .roomId(message.getRoomId())
                .deliveredTo(new TreeSet<>(message.getDeliveredTo()))
                .readBy(new TreeSet<>(message.getReadBy()))
                .build();
    }
}
