package com.aidlc.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Named policy governing branch shape, pull-request timing and auto-merge eligibility.
 * <p>
 * TRUNK: ephemeral branch per unit, auto-merged after validation, no PRs.
 * BOLT: branch and PR per bolt (sub-division of a unit).
 * UNIT: branch and PR per unit.
 * INTENT: one branch and one PR for the whole intent.
 */
public enum ChangeStrategy {
    TRUNK,
    BOLT,
    UNIT,
    INTENT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a configured strategy name. Unknown names are not mapped to a default.
     */
    public static Optional<ChangeStrategy> fromValue(String value) {
        if (value == null) return Optional.empty();
        for (ChangeStrategy s : values()) {
            if (s.value().equals(value.trim().toLowerCase(Locale.ROOT))) return Optional.of(s);
        }
        return Optional.empty();
    }
}
