package com.aidlc.core.model;

import java.util.Optional;

/**
 * Lifecycle status of an intent.
 */
public enum IntentStatus {
    ACTIVE("active"),
    COMPLETED("completed");

    private final String value;

    IntentStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<IntentStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        for (IntentStatus s : values()) {
            if (s.value.equals(value.trim())) return Optional.of(s);
        }
        return Optional.empty();
    }
}
