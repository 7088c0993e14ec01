package com.chatbridge.websocket.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Envelope of everything the server pushes to a connection:
 * {@code {"event": "...", "payload": {...}}}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ServerEvent {
    private String event;
    private Object payload;
}
