package com.chatbridge.readreceipt.service;

import com.chatbridge.exception.MessageNotFoundException;
import com.chatbridge.message.domain.ChatMessage;
import com.chatbridge.readreceipt.dto.MessageReceipts;
import com.chatbridge.room.service.RoomDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivery and read receipts per message, plus the per-room timeline used
 * for "recent messages".
 *
 * Delivered-to and read-by are independent, grow-only sets: marking read
 * neither requires nor implies a prior delivery mark.
 */
@Slf4j
@Service
public class DeliveryTracker {

    private final ConcurrentHashMap<String, ChatMessage> messages = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RoomTimeline> timelines = new ConcurrentHashMap<>();
    private final RoomDirectory roomDirectory;
    private final int maxMessagesPerRoom;

    public DeliveryTracker(RoomDirectory roomDirectory,
                           @Value("${chat.history.max-messages-per-room:1000}") int maxMessagesPerRoom) {
        this.roomDirectory = roomDirectory;
        this.maxMessagesPerRoom = maxMessagesPerRoom;
    }

    /**
     * Stores a new message with empty receipt sets and stamps the room's
     * last activity.
     *
     * @throws com.chatbridge.exception.RoomNotFoundException if the room does not exist
     */
    public void recordMessage(ChatMessage message) {
        roomDirectory.requireRoom(message.getRoomId());
        if (messages.putIfAbsent(message.getMessageId(), message) != null) {
            throw new IllegalArgumentException("Duplicate message id: " + message.getMessageId());
        }
        roomDirectory.touchActivity(message.getRoomId());

        List<ChatMessage> evicted = timelines
                .computeIfAbsent(message.getRoomId(), roomId -> new RoomTimeline(maxMessagesPerRoom))
                .add(message);
        for (ChatMessage old : evicted) {
            messages.remove(old.getMessageId());
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} cached messages from room {}", evicted.size(), message.getRoomId());
        }
    }

    /**
     * @return true if the user was newly added to the delivered-to set
     */
    public boolean markDelivered(String messageId, String userId) {
        return requireMessage(messageId).addDelivered(userId);
    }

    /**
     * @return true if the user was newly added to the read-by set
     */
    public boolean markRead(String messageId, String userId) {
        return requireMessage(messageId).addRead(userId);
    }

    /**
     * Messages of the room, most recent first, paginated over that order.
     */
    public List<ChatMessage> getRoomMessages(String roomId, int limit, int offset) {
        if (limit <= 0) {
            return List.of();
        }
        RoomTimeline timeline = timelines.get(roomId);
        if (timeline == null) {
            return List.of();
        }
        return timeline.page(limit, Math.max(0, offset));
    }

    public Optional<ChatMessage> getMessage(String messageId) {
        return messageId == null ? Optional.empty() : Optional.ofNullable(messages.get(messageId));
    }

    /**
     * Cached messages of the room that the user neither sent nor marked read.
     */
    public int unreadCount(String roomId, String userId) {
        RoomTimeline timeline = timelines.get(roomId);
        if (timeline == null || userId == null) {
            return 0;
        }
        return timeline.count(message -> !userId.equals(message.getSenderId()) && !message.isReadBy(userId));
    }

    public Optional<ChatMessage> lastMessage(String roomId) {
        RoomTimeline timeline = timelines.get(roomId);
        return timeline == null ? Optional.empty() : timeline.latest();
    }

    public ChatMessage requireMessage(String messageId) {
        return getMessage(messageId)
                .orElseThrow(() -> new MessageNotFoundException("Message not found: " + messageId));
    }

    public MessageReceipts receipts(String messageId) {
        return MessageReceipts.from(requireMessage(messageId));
    }

    public int messageCount(String roomId) {
        RoomTimeline timeline = timelines.get(roomId);
        return timeline == null ? 0 : timeline.size();
    }
}
