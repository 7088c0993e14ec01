package com.chatbridge.exception;

public class MessageNotFoundException extends ChatException {
    public MessageNotFoundException(String message) {
        super(ChatErrorCode.MESSAGE_NOT_FOUND, message);
    }
}
