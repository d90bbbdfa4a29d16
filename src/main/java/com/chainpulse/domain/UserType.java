package com.chainpulse.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Behavioural class of an accumulated user; see {@code UserAggregator} for the thresholds.
 */
public enum UserType {
    WHALE("whale"),
    POWER_USER("power_user"),
    ACTIVE("active"),
    EVENT_ACTIVE("event_active"),
    CASUAL("casual");

    private final String label;

    UserType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
