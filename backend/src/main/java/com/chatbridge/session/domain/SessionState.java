package com.chatbridge.session.domain;

public enum SessionState {
    UNAUTHENTICATED,
    AUTHENTICATED,
    CLOSED
}
