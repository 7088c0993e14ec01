package com.chatbridge.readreceipt.service;

import com.chatbridge.message.domain.ChatMessage;
import com.chatbridge.room.dto.LastMessagePreview;
import com.chatbridge.room.dto.RoomSummary;
import com.chatbridge.room.service.RoomDirectory;
import com.chatbridge.user.service.UserRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Unread counts and last-message previews for a user's room list.
 *
 * Unread = cached messages of the room that the user did not send and has
 * not marked read. Counts are derived from the read-by sets on every call,
 * so marking a message read lowers the count without extra bookkeeping.
 */
@Service
@RequiredArgsConstructor
public class UnreadCountService {

    private final DeliveryTracker deliveryTracker;
    private final RoomDirectory roomDirectory;
    private final UserRegistry userRegistry;

    /**
     * @return 0 for rooms the user is not a member of
     */
    public int getUnreadCount(String userId, String roomId) {
        if (!roomDirectory.isMember(userId, roomId)) {
            return 0;
        }
        return deliveryTracker.unreadCount(roomId, userId);
    }

    public Optional<LastMessagePreview> getLastMessage(String roomId) {
        return deliveryTracker.lastMessage(roomId).map(this::toPreview);
    }

    /**
     * Rooms visible to the user, each with its last message and, for rooms
     * the user belongs to, the unread count.
     */
    public List<RoomSummary> listRoomsFor(String userId) {
        return roomDirectory.listVisibleRooms(userId).stream()
                .map(room -> room.toBuilder()
                        .unreadCount(room.getMembers().contains(userId)
                                ? deliveryTracker.unreadCount(room.getRoomId(), userId)
                                : null)
                        .lastMessage(getLastMessage(room.getRoomId()).orElse(null))
                        .build())
                .collect(Collectors.toList());
    }

    private LastMessagePreview toPreview(ChatMessage message) {
        return LastMessagePreview.builder()
                .messageId(message.getMessageId())
                .content(message.getContent())
                .senderId(message.getSenderId())
                .sender(userRegistry.displayNameOf(message.getSenderId()))
                .sentAt(message.getCreatedAt())
                .build();
    }
}
