package com.chatbridge.readreceipt.service;

import com.chatbridge.message.domain.ChatMessage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Messages of one room in creation order, capped to the most recent
 * {@code capacity} entries. Guarded by its own monitor, so rooms never
 * contend with each other.
 */
class RoomTimeline {

    private final TreeSet<ChatMessage> messages = new TreeSet<>(ChatMessage.CHRONOLOGICAL);
    private final int capacity;

    RoomTimeline(int capacity) {
        this.capacity = capacity;
    }

    /**
     * @return messages pushed out of the cache by this insert, oldest first
     */
    synchronized List<ChatMessage> add(ChatMessage message) {
        messages.add(message);
        List<ChatMessage> evicted = new ArrayList<>();
        while (messages.size() > capacity) {
            evicted.add(messages.pollFirst());
        }
        return evicted;
    }

    /**
     * Newest first, skipping {@code offset} and returning at most {@code limit}.
     */
    synchronized List<ChatMessage> page(int limit, int offset) {
        List<ChatMessage> page = new ArrayList<>(Math.min(limit, messages.size()));
        Iterator<ChatMessage> newestFirst = messages.descendingIterator();
        int skipped = 0;
        while (newestFirst.hasNext() && page.size() < limit) {
            ChatMessage message = newestFirst.next();
            if (skipped < offset) {
                skipped++;
                continue;
            }
            page.add(message);
        }
        return page;
    }

    synchronized int count(Predicate<ChatMessage> filter) {
        int matching = 0;
        for (ChatMessage message : messages) {
            if (filter.test(message)) {
                matching++;
            }
        }
        return matching;
    }

    synchronized Optional<ChatMessage> latest() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.last());
    }

    synchronized int size() {
        return messages.size();
    }
}
