package com.chatbridge.exception;

public class NotRoomMemberException extends ChatException {
    public NotRoomMemberException(String message) {
        super(ChatErrorCode.NOT_ROOM_MEMBER, message);
    }
}
