package com.chatbridge.message.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum MessageType {
    TEXT("text"),
    IMAGE("image"),
    FILE("file");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equalsIgnoreCase(value))
                .findFirst();
    }
}
