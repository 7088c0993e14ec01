package com.chatbridge.exception;

/**
 * Base class of every recoverable, connection-scoped failure.
 * Terminates only the requested operation; never the coordinator.
 */
public abstract class ChatException extends RuntimeException {

    private final ChatErrorCode errorCode;

    protected ChatException(ChatErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ChatErrorCode getErrorCode() {
        return errorCode;
    }
}
