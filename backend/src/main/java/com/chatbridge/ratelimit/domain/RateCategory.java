package com.chatbridge.ratelimit.domain;

/**
 * Independently limited kinds of user action.
 */
public enum RateCategory {
    MESSAGE("message"),
    CONNECTION("connection");

    private final String label;

    RateCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
