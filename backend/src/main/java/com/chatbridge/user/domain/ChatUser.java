package com.chatbridge.user.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Identity established by the auth collaborator on first authentication.
 * Immutable; a changed display name replaces the instance.
 */
@Getter
@Builder(toBuilder = true)
public class ChatUser {

    private final String userId;

    private final String displayName;

    private final Instant createdAt;
}
