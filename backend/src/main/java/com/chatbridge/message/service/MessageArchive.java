package com.chatbridge.message.service;

import com.chatbridge.message.domain.ChatMessage;

/**
 * Durable message store. The in-memory timeline is only a cache in front of it.
 */
public interface MessageArchive {
    void archive(ChatMessage message);
}
