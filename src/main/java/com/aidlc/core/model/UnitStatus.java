package com.aidlc.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle status of a unit. The lower-case {@link #value()} is the form stored in unit records.
 */
public enum UnitStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    BLOCKED("blocked");

    private final String value;

    UnitStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a stored status value. Only the four exact record values are accepted.
     *
     * @param value raw value, e.g. {@code in_progress}
     * @return the status, or empty if the value is not one of the four
     */
    public static Optional<UnitStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.value.equals(trimmed))
                .findFirst();
    }
}
