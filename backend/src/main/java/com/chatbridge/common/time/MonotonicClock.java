package com.chatbridge.common.time;

/**
 * Source of monotonic ticks shared by every time-based component
 * (typing expiry, rate windows).
 *
 * Ticks are only meaningful relative to each other. Wall-clock adjustments
 * never move them backwards, so an expired entry cannot come back to life.
 */
@FunctionalInterface
public interface MonotonicClock {

    /**
     * @return current tick in nanoseconds
     */
    long nanoTime();

    static MonotonicClock system() {
        return System::nanoTime;
    }
}
