package com.chatbridge.room.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum RoomType {
    PUBLIC("public"),
    PRIVATE("private");

    private final String wireName;

    RoomType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<RoomType> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equalsIgnoreCase(value))
                .findFirst();
    }
}
