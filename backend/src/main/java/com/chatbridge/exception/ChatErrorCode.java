package com.chatbridge.exception;

/**
 * Error codes surfaced to the originating connection in {@code error} events.
 */
public enum ChatErrorCode {
    UNKNOWN_USER,
    ROOM_NOT_FOUND,
    NOT_ROOM_MEMBER,
    INVALID_NAME,
    INVALID_CONTENT,
    MESSAGE_NOT_FOUND,
    RATE_LIMITED,
    UNAUTHENTICATED,
    INTERNAL_ERROR
}
