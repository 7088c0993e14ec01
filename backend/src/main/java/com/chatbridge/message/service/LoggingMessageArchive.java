package com.chatbridge.message.service;

import com.chatbridge.message.domain.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Non-durable archive that logs recorded messages instead of persisting them.
 * Used until a database-backed {@link MessageArchive} is wired in.
 */
@Slf4j
@Service
public class LoggingMessageArchive implements MessageArchive {

    @Override
    public void archive(ChatMessage message) {
        log.debug("[ARCHIVE] messageId={}, roomId={}, senderId={}, type={}, length={}",
                message.getMessageId(), message.getRoomId(), message.getSenderId(),
                message.getMessageType(), message.getContent().length());
    }
}
