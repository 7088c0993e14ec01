package com.chatbridge.exception;

public class UnauthenticatedException extends ChatException {
    public UnauthenticatedException(String message) {
        super(ChatErrorCode.UNAUTHENTICATED, message);
    }
}
