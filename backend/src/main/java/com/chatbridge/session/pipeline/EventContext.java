package com.chatbridge.session.pipeline;

import com.chatbridge.message.domain.MessageType;
import com.chatbridge.session.domain.ClientSession;
import lombok.Builder;
import lombok.Getter;

/**
 * Input of one client event as seen by the validation steps.
 *
 * Steps that resolve something (the room of a message, the message type)
 * write it back here for the steps after them and for the handler.
 */
@Getter
public class EventContext {

    private final ClientSession session;

    private String roomId;

    private final String messageId;

    private final String content;

    private final String rawMessageType;

    private MessageType messageType;

    @Builder
    public EventContext(ClientSession session, String roomId, String messageId,
                        String content, String rawMessageType) {
        this.session = session;
        this.roomId = roomId;
        this.messageId = messageId;
        this.content = content;
        this.rawMessageType = rawMessageType;
    }

    public String getUserId() {
        return session.getUserId();
    }

    void resolveRoom(String roomId) {
        this.roomId = roomId;
    }

    void resolveMessageType(MessageType messageType) {
        this.messageType = messageType;
    }
}
