package com.chatbridge.message.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Generates timestamp-based message IDs.
 * Format: {unix_timestamp_ms}.{6-digit-sequence}
 * Example: "1640995200123.000001"
 *
 * - Unique per process
 * - Chronologically sortable
 * - Never blocks: a clock that stalls or steps back keeps the last
 *   timestamp and advances the sequence instead of waiting
 */
@Slf4j
@Service
public class MessageTimestampGenerator {

    private static final long MAX_SEQUENCE = 999999L;

    private final Clock clock;
    private long lastTimestamp = -1L;
    private long sequence = 0L;

    public MessageTimestampGenerator(Clock clock) {
        this.clock = clock;
    }

    public synchronized String generateTimestampId() {
        long currentTimestamp = clock.millis();

        if (currentTimestamp > lastTimestamp) {
            lastTimestamp = currentTimestamp;
            sequence = 0L;
        } else {
            if (currentTimestamp < lastTimestamp) {
                log.warn("Clock moved backwards. Current: {}, Last: {}. Reusing last timestamp.",
                        currentTimestamp, lastTimestamp);
            }
            sequence++;
            if (sequence > MAX_SEQUENCE) {
                // Borrow the next millisecond; the wall clock catches up later
                lastTimestamp++;
                sequence = 0L;
            }
        }

        return formatTimestampId(lastTimestamp, sequence);
    }

    private String formatTimestampId(long timestamp, long sequence) {
        return String.format("%d.%06d", timestamp, sequence);
    }
}
