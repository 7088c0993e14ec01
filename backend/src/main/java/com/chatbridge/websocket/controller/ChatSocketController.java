package com.chatbridge.websocket.controller;

import com.chatbridge.session.service.SessionCoordinator;
import com.chatbridge.websocket.dto.AuthenticateRequest;
import com.chatbridge.websocket.dto.CreateRoomRequest;
import com.chatbridge.websocket.dto.MessagesQuery;
import com.chatbridge.websocket.dto.ReceiptRequest;
import com.chatbridge.websocket.dto.RoomRequest;
import com.chatbridge.websocket.dto.SendMessageRequest;
import com.chatbridge.websocket.dto.UserSearchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * 클라이언트 이벤트를 받아 SessionCoordinator로 전달합니다.
 * 클라이언트는 /app/{event}로 보내고 /user/queue/events를 구독합니다.
 * 응답과 에러는 모두 이벤트 봉투({event, payload})로 전달됩니다.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ChatSocketController {

    private final SessionCoordinator sessionCoordinator;

    @MessageMapping("/authenticate")
    public void authenticate(@Payload(required = false) AuthenticateRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.authenticate(accessor.getSessionId(), request != null ? request.getToken() : null);
    }

    @MessageMapping("/create_room")
    public void createRoom(@Payload(required = false) CreateRoomRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.createRoom(accessor.getSessionId(), request != null ? request : new CreateRoomRequest());
    }

    @MessageMapping("/join_room")
    public void joinRoom(@Payload(required = false) RoomRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.joinRoom(accessor.getSessionId(), roomIdOf(request));
    }

    @MessageMapping("/leave_room")
    public void leaveRoom(@Payload(required = false) RoomRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.leaveRoom(accessor.getSessionId(), roomIdOf(request));
    }

    /**
     * 메시지 전송. 유효성 검사와 rate limit은 SessionCoordinator에서 처리합니다.
     */
    @MessageMapping("/send_message")
    public void sendMessage(@Payload(required = false) SendMessageRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.sendMessage(accessor.getSessionId(), request != null ? request : new SendMessageRequest());
    }

    @MessageMapping("/mark_read")
    public void markRead(@Payload(required = false) ReceiptRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.markRead(accessor.getSessionId(), messageIdOf(request));
    }

    @MessageMapping("/mark_delivered")
    public void markDelivered(@Payload(required = false) ReceiptRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.markDelivered(accessor.getSessionId(), messageIdOf(request));
    }

    @MessageMapping("/get_messages")
    public void getMessages(@Payload(required = false) MessagesQuery query, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.getMessages(accessor.getSessionId(), query != null ? query : new MessagesQuery());
    }

    @MessageMapping("/typing_start")
    public void typingStart(@Payload(required = false) RoomRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.typingStart(accessor.getSessionId(), roomIdOf(request));
    }

    @MessageMapping("/typing_stop")
    public void typingStop(@Payload(required = false) RoomRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.typingStop(accessor.getSessionId(), roomIdOf(request));
    }

    @MessageMapping("/get_typing_users")
    public void getTypingUsers(@Payload(required = false) RoomRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.getTypingUsers(accessor.getSessionId(), roomIdOf(request));
    }

    @MessageMapping("/heartbeat")
    public void heartbeat(SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.heartbeat(accessor.getSessionId());
    }

    @MessageMapping("/get_online_users")
    public void getOnlineUsers(SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.getOnlineUsers(accessor.getSessionId());
    }

    @MessageMapping("/get_rooms")
    public void getRooms(SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.getRooms(accessor.getSessionId());
    }

    @MessageMapping("/get_all_users")
    public void getAllUsers(SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.getAllUsers(accessor.getSessionId());
    }

    @MessageMapping("/search_users")
    public void searchUsers(@Payload(required = false) UserSearchRequest request, SimpMessageHeaderAccessor accessor) {
        sessionCoordinator.searchUsers(accessor.getSessionId(), request != null ? request.getQuery() : null);
    }

    private String roomIdOf(RoomRequest request) {
        return request != null ? request.getRoomId() : null;
    }

    private String messageIdOf(ReceiptRequest request) {
        return request != null ? request.getMessageId() : null;
    }
}
