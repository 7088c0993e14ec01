package com.chatbridge.exception;

public class InvalidContentException extends ChatException {
    public InvalidContentException(String message) {
        super(ChatErrorCode.INVALID_CONTENT, message);
    }
}
