package com.chatbridge.websocket.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Hands deliveries to the bounded fan-out executor so that mutations never
 * wait on a slow connection. When the queue is full the delivery is dropped
 * with a warning and the caller carries on.
 */
@Slf4j
@Component
public class FanoutDispatcher {

    private final Broadcaster broadcaster;
    private final Executor executor;

    public FanoutDispatcher(Broadcaster broadcaster,
                            @Qualifier("fanoutExecutor") Executor executor) {
        this.broadcaster = broadcaster;
        this.executor = executor;
    }

    public void dispatch(Set<String> connectionIds, String event, Object payload) {
        if (connectionIds.isEmpty()) {
            return;
        }
        Set<String> recipients = Set.copyOf(connectionIds);
        try {
            executor.execute(() -> deliver(recipients, event, payload));
        } catch (TaskRejectedException e) {
            log.warn("Fan-out queue full, dropping {} for {} connections", event, recipients.size());
        }
    }

    public void dispatch(String connectionId, String event, Object payload) {
        dispatch(Set.of(connectionId), event, payload);
    }

    private void deliver(Set<String> recipients, String event, Object payload) {
        try {
            Set<String> failed = broadcaster.deliver(recipients, event, payload);
            if (!failed.isEmpty()) {
                log.warn("Failed to deliver {} to {} of {} connections", event, failed.size(), recipients.size());
            }
        } catch (RuntimeException e) {
            log.warn("Fan-out of {} failed", event, e);
        }
    }
}
