package com.chatbridge.session.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one client connection.
 *
 * Events of a connection are serialized through {@link #lock()}. The state is
 * volatile so {@link #close()} can be observed by a handler that is already
 * waiting on the lock.
 */
@Getter
public class ClientSession {

    private final String connectionId;

    private final Instant connectedAt;

    private volatile SessionState state = SessionState.UNAUTHENTICATED;

    private volatile String userId;

    @Getter(lombok.AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    public ClientSession(String connectionId, Instant connectedAt) {
        this.connectionId = connectionId;
        this.connectedAt = connectedAt;
    }

    /**
     * Binds the user. A session closed meanwhile keeps its user, for offline
     * cleanup, but stays closed.
     */
    public void authenticate(String userId) {
        this.userId = userId;
        if (state != SessionState.CLOSED) {
            this.state = SessionState.AUTHENTICATED;
        }
    }

    /**
     * Terminal. Safe to call without holding the lock and more than once.
     *
     * @return true if this call closed the session
     */
    public boolean close() {
        if (state == SessionState.CLOSED) {
            return false;
        }
        state = SessionState.CLOSED;
        return true;
    }

    public boolean isAuthenticated() {
        return state == SessionState.AUTHENTICATED;
    }

    public boolean isClosed() {
        return state == SessionState.CLOSED;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }
}
