package com.chatbridge.websocket.service;

import java.util.Set;

/**
 * Pushes one event to a set of connections, best effort.
 */
public interface Broadcaster {

    /**
     * @return the connections the event could not be handed to
     */
    Set<String> deliver(Set<String> connectionIds, String event, Object payload);
}
