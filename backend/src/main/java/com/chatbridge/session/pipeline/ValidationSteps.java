package com.chatbridge.session.pipeline;

import com.chatbridge.exception.InvalidContentException;
import com.chatbridge.exception.MessageNotFoundException;
import com.chatbridge.exception.NotRoomMemberException;
import com.chatbridge.exception.RateLimitedException;
import com.chatbridge.exception.RoomNotFoundException;
import com.chatbridge.exception.UnauthenticatedException;
import com.chatbridge.message.domain.ChatMessage;
import com.chatbridge.message.domain.MessageType;
import com.chatbridge.ratelimit.domain.RateCategory;
import com.chatbridge.ratelimit.service.RateLimiter;
import com.chatbridge.readreceipt.service.DeliveryTracker;
import com.chatbridge.room.service.RoomDirectory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The individual checks client events are validated with.
 * Only {@link #rateAdmission(RateCategory)} records anything, so it must be
 * the last step of a pipeline.
 */
@Component
public class ValidationSteps {

    private final RoomDirectory roomDirectory;
    private final DeliveryTracker deliveryTracker;
    private final RateLimiter rateLimiter;
    private final int maxContentLength;

    public ValidationSteps(RoomDirectory roomDirectory,
                           DeliveryTracker deliveryTracker,
                           RateLimiter rateLimiter,
                           @Value("${chat.message.max-length:1000}") int maxContentLength) {
        this.roomDirectory = roomDirectory;
        this.deliveryTracker = deliveryTracker;
        this.rateLimiter = rateLimiter;
        this.maxContentLength = maxContentLength;
    }

    public ValidationStep<EventContext> authenticated() {
        return context -> context.getSession().isAuthenticated()
                ? StepResult.ok()
                : StepResult.fail(new UnauthenticatedException("Authentication required"));
    }

    public ValidationStep<EventContext> roomExists() {
        return context -> {
            String roomId = context.getRoomId();
            if (roomId == null || roomId.isBlank()) {
                return StepResult.fail(new RoomNotFoundException("Room ID required"));
            }
            return roomDirectory.exists(roomId)
                    ? StepResult.ok()
                    : StepResult.fail(new RoomNotFoundException("Room not found: " + roomId));
        };
    }

    /**
     * Resolves the message and takes its room as the room of the event.
     */
    public ValidationStep<EventContext> messageExists() {
        return context -> {
            String messageId = context.getMessageId();
            if (messageId == null || messageId.isBlank()) {
                return StepResult.fail(new MessageNotFoundException("Message ID required"));
            }
            Optional<ChatMessage> message = deliveryTracker.getMessage(messageId);
            if (message.isEmpty()) {
                return StepResult.fail(new MessageNotFoundException("Message not found: " + messageId));
            }
            context.resolveRoom(message.get().getRoomId());
            return StepResult.ok();
        };
    }

    public ValidationStep<EventContext> membership() {
        return context -> roomDirectory.isMember(context.getUserId(), context.getRoomId())
                ? StepResult.ok()
                : StepResult.fail(new NotRoomMemberException("User is not a member of this room"));
    }

    public ValidationStep<EventContext> content() {
        return context -> {
            String content = context.getContent();
            if (content == null || content.isBlank()) {
                return StepResult.fail(new InvalidContentException("Message content must not be empty"));
            }
            if (content.codePointCount(0, content.length()) > maxContentLength) {
                return StepResult.fail(new InvalidContentException(
                        "Message content must be at most " + maxContentLength + " characters"));
            }
            String rawType = context.getRawMessageType();
            if (rawType == null || rawType.isBlank()) {
                context.resolveMessageType(MessageType.TEXT);
                return StepResult.ok();
            }
            Optional<MessageType> type = MessageType.fromWireName(rawType);
            if (type.isEmpty()) {
                return StepResult.fail(new InvalidContentException("Unknown message type: " + rawType));
            }
            context.resolveMessageType(type.get());
            return StepResult.ok();
        };
    }

    public ValidationStep<EventContext> rateAdmission(RateCategory category) {
        return context -> {
            try {
                rateLimiter.admit(context.getUserId(), category);
                return StepResult.ok();
            } catch (RateLimitedException e) {
                return StepResult.fail(e);
            }
        };
    }
}
