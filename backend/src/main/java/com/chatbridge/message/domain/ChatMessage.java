package com.chatbridge.message.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Comparator;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A message sent to a room. Everything is fixed at creation except the two
 * receipt sets, which only ever grow.
 */
@Getter
public class ChatMessage {

    /**
     * Oldest first: creation time, then id.
     */
    public static final Comparator<ChatMessage> CHRONOLOGICAL =
            Comparator.comparing(ChatMessage::getCreatedAt).thenComparing(ChatMessage::getMessageId);

    private final String messageId;

    private final String roomId;

    private final String senderId;

    private final String content;

    private final MessageType messageType;

    private final Instant createdAt;

    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> deliveredTo = ConcurrentHashMap.newKeySet();

    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> readBy = ConcurrentHashMap.newKeySet();

    @Builder
    public ChatMessage(String messageId, String roomId, String senderId, String content,
                       MessageType messageType, Instant createdAt) {
        this.messageId = messageId;
        this.roomId = roomId;
        this.senderId = senderId;
        this.content = content;
        this.messageType = messageType != null ? messageType : MessageType.TEXT;
        this.createdAt = createdAt;
    }

    /**
     * @return true if the user was not yet in the delivered-to set
     */
    public boolean addDelivered(String userId) {
        return deliveredTo.add(userId);
    }

    /**
     * @return true if the user was not yet in the read-by set
     */
    public boolean addRead(String userId) {
        return readBy.add(userId);
    }

    public boolean isReadBy(String userId) {
        return readBy.contains(userId);
    }

    public Set<String> getDeliveredTo() {
        return Set.copyOf(deliveredTo);
    }

    public Set<String> getReadBy() {
        return Set.copyOf(readBy);
    }
}
