package com.chatbridge.session.service;

import com.chatbridge.auth.dto.VerifiedIdentity;
import com.chatbridge.auth.service.IdentityVerifier;
import com.chatbridge.exception.ChatErrorCode;
import com.chatbridge.exception.ChatException;
import com.chatbridge.exception.InvalidContentException;
import com.chatbridge.exception.RateLimitedException;
import com.chatbridge.exception.UnauthenticatedException;
import com.chatbridge.message.domain.ChatMessage;
import com.chatbridge.message.service.MessageArchive;
import com.chatbridge.message.service.MessageTimestampGenerator;
import com.chatbridge.presence.service.PresenceRegistry;
import com.chatbridge.ratelimit.domain.RateCategory;
import com.chatbridge.ratelimit.service.RateLimiter;
import com.chatbridge.readreceipt.service.DeliveryTracker;
import com.chatbridge.readreceipt.service.UnreadCountService;
import com.chatbridge.room.domain.Room;
import com.chatbridge.room.domain.RoomType;
import com.chatbridge.room.dto.RoomSummary;
import com.chatbridge.room.service.RoomDirectory;
import com.chatbridge.session.domain.ClientSession;
import com.chatbridge.session.pipeline.EventContext;
import com.chatbridge.session.pipeline.ValidationPipeline;
import com.chatbridge.session.pipeline.ValidationSteps;
import com.chatbridge.typing.service.TypingTracker;
import com.chatbridge.user.domain.ChatUser;
import com.chatbridge.user.service.UserRegistry;
import com.chatbridge.websocket.dto.AuthenticatedPayload;
import com.chatbridge.websocket.dto.CreateRoomRequest;
import com.chatbridge.websocket.dto.ErrorPayload;
import com.chatbridge.websocket.dto.HeartbeatPayload;
import com.chatbridge.websocket.dto.MembershipPayload;
import com.chatbridge.websocket.dto.MessagePayload;
import com.chatbridge.websocket.dto.MessagesQuery;
import com.chatbridge.websocket.dto.OnlineUsersPayload;
import com.chatbridge.websocket.dto.PresencePayload;
import com.chatbridge.websocket.dto.ReceiptPayload;
import com.chatbridge.websocket.dto.RoomListPayload;
import com.chatbridge.websocket.dto.RoomMessagesPayload;
import com.chatbridge.websocket.dto.SendConfirmation;
import com.chatbridge.websocket.dto.SendMessageRequest;
import com.chatbridge.websocket.dto.TypingPayload;
import com.chatbridge.websocket.dto.TypingUsersPayload;
import com.chatbridge.websocket.dto.UserListPayload;
import com.chatbridge.websocket.dto.UserSearchPayload;
import com.chatbridge.websocket.service.FanoutDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Per-connection state machine tying the registries together.
 *
 * Every client event runs under its connection's lock, goes through a
 * validation pipeline, mutates the registries and finally hands the
 * resulting deliveries to the {@link FanoutDispatcher}. A rejected event
 * produces one {@code error} event for its originator and changes nothing.
 */
@Slf4j
@Service
public class SessionCoordinator {

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 100;

    private final ConcurrentHashMap<String, ClientSession> sessions = new ConcurrentHashMap<>();

    private final IdentityVerifier identityVerifier;
    private final UserRegistry userRegistry;
    private final PresenceRegistry presenceRegistry;
    private final RoomDirectory roomDirectory;
    private final DeliveryTracker deliveryTracker;
    private final UnreadCountService unreadCountService;
    private final TypingTracker typingTracker;
    private final RateLimiter rateLimiter;
    private final MessageTimestampGenerator timestampGenerator;
    private final MessageArchive messageArchive;
    private final FanoutDispatcher fanout;
    private final Clock clock;
    private final int recentMessageCount;

    private final ValidationPipeline<EventContext> authenticatedOnly;
    private final ValidationPipeline<EventContext> roomAccess;
    private final ValidationPipeline<EventContext> memberAccess;
    private final ValidationPipeline<EventContext> messageSend;
    private final ValidationPipeline<EventContext> receiptAccess;

    public SessionCoordinator(IdentityVerifier identityVerifier,
                              UserRegistry userRegistry,
                              PresenceRegistry presenceRegistry,
                              RoomDirectory roomDirectory,
                              DeliveryTracker deliveryTracker,
                              UnreadCountService unreadCountService,
                              TypingTracker typingTracker,
                              RateLimiter rateLimiter,
                              MessageTimestampGenerator timestampGenerator,
                              MessageArchive messageArchive,
                              FanoutDispatcher fanout,
                              ValidationSteps steps,
                              Clock clock,
                              @Value("${chat.room.recent-messages:20}") int recentMessageCount) {
        this.identityVerifier = identityVerifier;
        this.userRegistry = userRegistry;
        this.presenceRegistry = presenceRegistry;
        this.roomDirectory = roomDirectory;
        this.deliveryTracker = deliveryTracker;
        this.unreadCountService = unreadCountService;
        this.typingTracker = typingTracker;
        this.rateLimiter = rateLimiter;
        this.timestampGenerator = timestampGenerator;
        this.messageArchive = messageArchive;
        this.fanout = fanout;
        this.clock = clock;
        this.recentMessageCount = recentMessageCount;

        this.authenticatedOnly = ValidationPipeline.of(steps.authenticated());
        this.roomAccess = ValidationPipeline.of(steps.authenticated(), steps.roomExists());
        this.memberAccess = ValidationPipeline.of(steps.authenticated(), steps.roomExists(), steps.membership());
        this.messageSend = ValidationPipeline.of(
                steps.authenticated(),
                steps.roomExists(),
                steps.membership(),
                steps.content(),
                steps.rateAdmission(RateCategory.MESSAGE));
        this.receiptAccess = ValidationPipeline.of(steps.authenticated(), steps.messageExists(), steps.membership());
    }

    // ===== lifecycle =====

    public void connect(String connectionId) {
        ClientSession existing = sessions.putIfAbsent(connectionId, new ClientSession(connectionId, clock.instant()));
        if (existing != null) {
            log.warn("Duplicate connect ignored: connectionId={}", connectionId);
            return;
        }
        log.debug("Connection opened: connectionId={}", connectionId);
    }

    /**
     * Terminal for the connection, from any state. Safe to call repeatedly.
     * The session is closed before its lock is taken, so events already
     * queued behind the lock abort instead of running.
     */
    public void disconnect(String connectionId) {
        ClientSession session = sessions.remove(connectionId);
        if (session == null || !session.close()) {
            return;
        }

        // Read under the lock: an authenticate already in flight sets the user first
        String userId;
        boolean wentOffline = false;
        session.lock();
        try {
            userId = session.getUserId();
            if (userId != null) {
                wentOffline = presenceRegistry.releaseConnection(userId, connectionId);
            }
        } finally {
            session.unlock();
        }

        if (wentOffline) {
            fanout.dispatch(presenceRegistry.onlineConnections(), "user_offline", presencePayload(userId));
        }
        log.info("Connection closed: connectionId={}, userId={}, wentOffline={}", connectionId, userId, wentOffline);
    }

    public void authenticate(String connectionId, String token) {
        handle(connectionId, "authenticate", session -> {
            if (session.isAuthenticated()) {
                reply(session, "authenticate_response", authenticatedPayload(session));
                return;
            }
            if (token == null || token.isBlank()) {
                throw new UnauthenticatedException("Authentication token required");
            }

            VerifiedIdentity identity = identityVerifier.verify(token);
            rateLimiter.admit(identity.userId(), RateCategory.CONNECTION);
            ChatUser user = userRegistry.register(identity.userId(), identity.displayName());
            presenceRegistry.setOnline(user.getUserId(), connectionId)
                    .ifPresent(previous -> log.info("User {} moved from connection {} to {}",
                            user.getUserId(), previous, connectionId));
            session.authenticate(user.getUserId());

            reply(session, "authenticate_response", authenticatedPayload(session));
            reply(session, "online_users", OnlineUsersPayload.builder()
                    .users(presenceRegistry.listOnline())
                    .build());
            reply(session, "available_rooms", RoomListPayload.builder()
                    .rooms(unreadCountService.listRoomsFor(user.getUserId()))
                    .build());
            fanout.dispatch(presenceRegistry.onlineConnections(), "user_online", presencePayload(user.getUserId()));
        });
    }

    // ===== rooms =====

    public void createRoom(String connectionId, CreateRoomRequest request) {
        handle(connectionId, "create_room", session -> {
            authenticatedOnly.run(context(session).build());

            RoomType type = RoomType.PUBLIC;
            if (request.getRoomType() != null && !request.getRoomType().isBlank()) {
                type = RoomType.fromWireName(request.getRoomType())
                        .orElseThrow(() -> new InvalidContentException("Unknown room type: " + request.getRoomType()));
            }
            List<String> memberIds = request.getMemberIds() != null ? request.getMemberIds() : List.of();

            Room room = roomDirectory.createRoom(request.getRoomName(), type, session.getUserId(), memberIds);
            RoomSummary summary = RoomSummary.from(room);

            reply(session, "create_room_response", summary);
            if (room.getType() == RoomType.PUBLIC) {
                fanout.dispatch(presenceRegistry.onlineConnections(), "room_created", summary);
            } else {
                fanout.dispatch(connectionsOf(room.getId()), "room_created", summary);
            }
        });
    }

    public void joinRoom(String connectionId, String roomId) {
        handle(connectionId, "join_room", session -> {
            roomAccess.run(context(session).roomId(roomId).build());

            String userId = session.getUserId();
            boolean joined = roomDirectory.join(userId, roomId);

            reply(session, "join_room_response", membershipPayload(roomId, userId));
            reply(session, "room_messages", roomMessages(roomId, recentMessageCount, 0));
            if (joined) {
                fanout.dispatch(connectionsOf(roomId), "user_joined_room", membershipPayload(roomId, userId));
            }
        });
    }

    public void leaveRoom(String connectionId, String roomId) {
        handle(connectionId, "leave_room", session -> {
            roomAccess.run(context(session).roomId(roomId).build());

            String userId = session.getUserId();
            boolean removed = roomDirectory.leave(userId, roomId);
            typingTracker.clearTyping(userId, roomId);

            reply(session, "leave_room_response", membershipPayload(roomId, userId));
            if (removed) {
                fanout.dispatch(connectionsOf(roomId), "user_left_room", membershipPayload(roomId, userId));
            }
        });
    }

    // ===== messages =====

    public void sendMessage(String connectionId, SendMessageRequest request) {
        handle(connectionId, "send_message", session -> {
            EventContext context = context(session)
                    .roomId(request.getRoomId())
                    .content(request.getContent())
                    .rawMessageType(request.getMessageType())
                    .build();
            messageSend.run(context);

            ChatMessage message = ChatMessage.builder()
                    .messageId(timestampGenerator.generateTimestampId())
                    .roomId(context.getRoomId())
                    .senderId(session.getUserId())
                    .content(context.getContent())
                    .messageType(context.getMessageType())
                    .createdAt(clock.instant())
                    .build();
            deliveryTracker.recordMessage(message);
            archive(message);
            typingTracker.clearTyping(session.getUserId(), message.getRoomId());

            fanout.dispatch(connectionsOf(message.getRoomId()), "new_message", toPayload(message));
            reply(session, "send_message_response", SendConfirmation.builder()
                    .messageId(message.getMessageId())
                    .roomId(message.getRoomId())
                    .timestamp(message.getCreatedAt())
                    .build());
        });
    }

    public void markRead(String connectionId, String messageId) {
        handle(connectionId, "mark_read", session -> {
            EventContext context = context(session).messageId(messageId).build();
            receiptAccess.run(context);

            deliveryTracker.markRead(messageId, session.getUserId());
            ReceiptPayload payload = receiptPayload(messageId, context.getRoomId(), session.getUserId());
            reply(session, "mark_read_response", payload);
            fanout.dispatch(connectionsOf(context.getRoomId()), "message_read", payload);
        });
    }

    public void markDelivered(String connectionId, String messageId) {
        handle(connectionId, "mark_delivered", session -> {
            EventContext context = context(session).messageId(messageId).build();
            receiptAccess.run(context);

            deliveryTracker.markDelivered(messageId, session.getUserId());
            ReceiptPayload payload = receiptPayload(messageId, context.getRoomId(), session.getUserId());
            reply(session, "mark_delivered_response", payload);
            fanout.dispatch(connectionsOf(context.getRoomId()), "message_delivered", payload);
        });
    }

    public void getMessages(String connectionId, MessagesQuery query) {
        handle(connectionId, "get_messages", session -> {
            memberAccess.run(context(session).roomId(query.getRoomId()).build());

            int limit = query.getLimit() != null ? Math.min(query.getLimit(), MAX_PAGE_SIZE) : DEFAULT_PAGE_SIZE;
            int offset = query.getOffset() != null ? Math.max(0, query.getOffset()) : 0;
            reply(session, "room_messages", roomMessages(query.getRoomId(), limit, offset));
        });
    }

    // ===== typing =====

    public void typingStart(String connectionId, String roomId) {
        handle(connectionId, "typing_start", session -> {
            memberAccess.run(context(session).roomId(roomId).build());

            typingTracker.setTyping(session.getUserId(), roomId);
            publishTyping(session, roomId, true);
        });
    }

    public void typingStop(String connectionId, String roomId) {
        handle(connectionId, "typing_stop", session -> {
            memberAccess.run(context(session).roomId(roomId).build());

            typingTracker.clearTyping(session.getUserId(), roomId);
            publishTyping(session, roomId, false);
        });
    }

    public void getTypingUsers(String connectionId, String roomId) {
        handle(connectionId, "get_typing_users", session -> {
            memberAccess.run(context(session).roomId(roomId).build());

            reply(session, "typing_users", TypingUsersPayload.builder()
                    .roomId(roomId)
                    .users(typingTracker.listTyping(roomId))
                    .build());
        });
    }

    // ===== presence =====

    public void heartbeat(String connectionId) {
        handle(connectionId, "heartbeat", session -> {
            authenticatedOnly.run(context(session).build());

            presenceRegistry.touch(session.getUserId());
            reply(session, "heartbeat_response", HeartbeatPayload.builder()
                    .timestamp(clock.instant())
                    .build());
        });
    }

    public void getOnlineUsers(String connectionId) {
        handle(connectionId, "get_online_users", session -> {
            authenticatedOnly.run(context(session).build());

            reply(session, "online_users", OnlineUsersPayload.builder()
                    .users(presenceRegistry.listOnline())
                    .build());
        });
    }

    public void getRooms(String connectionId) {
        handle(connectionId, "get_rooms", session -> {
            authenticatedOnly.run(context(session).build());

            reply(session, "available_rooms", RoomListPayload.builder()
                    .rooms(unreadCountService.listRoomsFor(session.getUserId()))
                    .build());
        });
    }

    public void getAllUsers(String connectionId) {
        handle(connectionId, "get_all_users", session -> {
            authenticatedOnly.run(context(session).build());

            reply(session, "all_users", UserListPayload.builder()
                    .users(presenceRegistry.listAll())
                    .build());
        });
    }

    public void searchUsers(String connectionId, String query) {
        handle(connectionId, "search_users", session -> {
            authenticatedOnly.run(context(session).build());

            String trimmed = query != null ? query.trim() : "";
            reply(session, "search_results", UserSearchPayload.builder()
                    .query(trimmed)
                    .users(presenceRegistry.search(trimmed))
                    .build());
        });
    }

    public Optional<ClientSession> session(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public int sessionCount() {
        return sessions.size();
    }

    // ===== internals =====

    /**
     * Runs one event under the connection's lock and turns any failure into
     * an {@code error} event for the originator only.
     */
    private void handle(String connectionId, String event, Consumer<ClientSession> action) {
        ClientSession session = sessions.get(connectionId);
        if (session == null) {
            log.warn("Event {} from unknown connection {}", event, connectionId);
            sendError(connectionId, ChatErrorCode.UNAUTHENTICATED, "Unknown connection");
            return;
        }

        session.lock();
        try {
            if (session.isClosed()) {
                log.debug("Dropping {} for closed connection {}", event, connectionId);
                return;
            }
            action.accept(session);
        } catch (RateLimitedException e) {
            log.debug("Rate limited {}: connectionId={}, userId={}", event, connectionId, session.getUserId());
            sendError(connectionId, e.getErrorCode(), e.getMessage());
        } catch (ChatException e) {
            log.warn("Rejected {}: connectionId={}, code={}, reason={}",
                    event, connectionId, e.getErrorCode(), e.getMessage());
            sendError(connectionId, e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error handling {} for connection {}", event, connectionId, e);
            sendError(connectionId, ChatErrorCode.INTERNAL_ERROR, "Internal server error");
        } finally {
            session.unlock();
        }
    }

    private void archive(ChatMessage message) {
        try {
            messageArchive.archive(message);
        } catch (RuntimeException e) {
            log.warn("Failed to archive message {}", message.getMessageId(), e);
        }
    }

    private void publishTyping(ClientSession session, String roomId, boolean typing) {
        String userId = session.getUserId();
        TypingPayload payload = TypingPayload.builder()
                .roomId(roomId)
                .userId(userId)
                .username(userRegistry.displayNameOf(userId))
                .typing(typing)
                .build();

        reply(session, typing ? "typing_start_response" : "typing_stop_response", payload);
        Set<String> audience = connectionsOf(roomId);
        audience.remove(session.getConnectionId());
        fanout.dispatch(audience, "user_typing", payload);
    }

    /**
     * Connections of the room's currently online members. A member without a
     * live connection just misses the event.
     */
    private Set<String> connectionsOf(String roomId) {
        return roomDirectory.members(roomId).stream()
                .map(presenceRegistry::connectionOf)
                .flatMap(Optional::stream)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private RoomMessagesPayload roomMessages(String roomId, int limit, int offset) {
        List<MessagePayload> messages = deliveryTracker.getRoomMessages(roomId, limit, offset).stream()
                .map(this::toPayload)
                .collect(Collectors.toList());
        return RoomMessagesPayload.builder()
                .roomId(roomId)
                .messages(messages)
                .limit(limit)
                .offset(offset)
                .build();
    }

    private MessagePayload toPayload(ChatMessage message) {
        return MessagePayload.from(message, userRegistry.displayNameOf(message.getSenderId()));
    }

    private AuthenticatedPayload authenticatedPayload(ClientSession session) {
        return AuthenticatedPayload.builder()
                .userId(session.getUserId())
                .username(userRegistry.displayNameOf(session.getUserId()))
                .connectionId(session.getConnectionId())
                .build();
    }

    private MembershipPayload membershipPayload(String roomId, String userId) {
        return MembershipPayload.builder()
                .roomId(roomId)
                .userId(userId)
                .username(userRegistry.displayNameOf(userId))
                .build();
    }

    private PresencePayload presencePayload(String userId) {
        return PresencePayload.builder()
                .userId(userId)
                .username(userRegistry.displayNameOf(userId))
                .timestamp(clock.instant())
                .build();
    }

    private ReceiptPayload receiptPayload(String messageId, String roomId, String userId) {
        return ReceiptPayload.builder()
                .messageId(messageId)
                .roomId(roomId)
                .userId(userId)
                .timestamp(clock.instant())
                .build();
    }

    private EventContext.EventContextBuilder context(ClientSession session) {
        return EventContext.builder().session(session);
    }

    private void reply(ClientSession session, String event, Object payload) {
        fanout.dispatch(session.getConnectionId(), event, payload);
    }

    private void sendError(String connectionId, ChatErrorCode code, String message) {
        fanout.dispatch(connectionId, "error", ErrorPayload.builder()
                .message(message)
                .code(code)
                .build());
    }
}
