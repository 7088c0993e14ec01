package com.chatbridge.websocket.service;

import com.chatbridge.websocket.dto.ServerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Delivers events over the STOMP broker, addressed by session id.
 * Clients subscribe to {@code /user/queue/events}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompBroadcaster implements Broadcaster {

    static final String EVENTS_DESTINATION = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public Set<String> deliver(Set<String> connectionIds, String event, Object payload) {
        ServerEvent envelope = new ServerEvent(event, payload);
        Set<String> failed = new LinkedHashSet<>();

        for (String connectionId : connectionIds) {
            try {
                messagingTemplate.convertAndSendToUser(
                        connectionId, EVENTS_DESTINATION, envelope, sessionHeaders(connectionId));
            } catch (MessagingException e) {
                log.debug("Failed to send {} to connection {}: {}", event, connectionId, e.getMessage());
                failed.add(connectionId);
            }
        }
        return failed;
    }

    private MessageHeaders sessionHeaders(String connectionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(connectionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
