package com.chatbridge.exception;

public class UnknownUserException extends ChatException {
    public UnknownUserException(String message) {
        super(ChatErrorCode.UNKNOWN_USER, message);
    }
}
