package com.chatbridge.exception;

public class InvalidNameException extends ChatException {
    public InvalidNameException(String message) {
        super(ChatErrorCode.INVALID_NAME, message);
    }
}
