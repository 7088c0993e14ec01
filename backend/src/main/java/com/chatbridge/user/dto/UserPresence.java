package com.chatbridge.user.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Point-in-time copy of a user's identity, presence and typing state.
 */
@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserPresence {

    private final String userId;

    private final String username;

    @JsonProperty("is_online")
    private final boolean online;

    private final Instant lastSeen;

    private final String typingIn;

    // Connection handles stay server-side
    @JsonIgnore
    private final String connectionId;
}
