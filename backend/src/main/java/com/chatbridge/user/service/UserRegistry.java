package com.chatbridge.user.service;

import com.chatbridge.exception.UnknownUserException;
import com.chatbridge.user.domain.ChatUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Known user identities. Users are created on first authentication and
 * never deleted here; account removal belongs to account management.
 */
@Slf4j
@Service("chatUserRegistry")
@RequiredArgsConstructor
public class UserRegistry {

    private final ConcurrentHashMap<String, ChatUser> users = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Finds or creates the user. A later authentication carrying a different
     * display name refreshes it.
     */
    public ChatUser register(String userId, String displayName) {
        Objects.requireNonNull(userId, "userId");
        String name = displayName == null || displayName.isBlank() ? userId : displayName;

        return users.compute(userId, (id, existing) -> {
            if (existing == null) {
                log.info("Registered user: userId={}, displayName={}", id, name);
                return ChatUser.builder()
                        .userId(id)
                        .displayName(name)
                        .createdAt(clock.instant())
                        .build();
            }
            if (!existing.getDisplayName().equals(name)) {
                return existing.toBuilder().displayName(name).build();
            }
            return existing;
        });
    }

    public Optional<ChatUser> find(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(users.get(userId));
    }

    public ChatUser require(String userId) {
        return find(userId)
                .orElseThrow(() -> new UnknownUserException("User not found: " + userId));
    }

    public boolean exists(String userId) {
        return userId != null && users.containsKey(userId);
    }

    public String displayNameOf(String userId) {
        return find(userId).map(ChatUser::getDisplayName).orElse(userId);
    }

    /**
     * Case-insensitive substring match on user id or display name.
     * A blank query matches nobody.
     */
    public List<ChatUser> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return users.values().stream()
                .filter(user -> user.getUserId().toLowerCase(Locale.ROOT).contains(needle)
                        || user.getDisplayName().toLowerCase(Locale.ROOT).contains(needle))
                .sorted(Comparator.comparing(ChatUser::getUserId))
                .collect(Collectors.toList());
    }

    public List<ChatUser> listUsers() {
        return users.values().stream()
                .sorted(Comparator.comparing(ChatUser::getUserId))
                .collect(Collectors.toList());
    }
}
