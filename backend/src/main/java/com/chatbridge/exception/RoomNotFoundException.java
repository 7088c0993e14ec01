package com.chatbridge.exception;

public class RoomNotFoundException extends ChatException {
    public RoomNotFoundException(String message) {
        super(ChatErrorCode.ROOM_NOT_FOUND, message);
    }
}
