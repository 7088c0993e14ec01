package com.chatbridge.common.controller;

import com.chatbridge.presence.service.PresenceRegistry;
import com.chatbridge.room.service.RoomDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final PresenceRegistry presenceRegistry;
    private final RoomDirectory roomDirectory;
    private final Clock clock;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "chatbridge");
        body.put("websocket", "/ws");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("online_users", presenceRegistry.onlineCount());
        body.put("rooms", roomDirectory.roomCount());
        body.put("timestamp", clock.instant().toString());
        return ResponseEntity.ok(body);
    }
}
