package com.aidlc.core.model;

/**
 * Structural problem found in a unit graph. Reported to the caller, never fatal.
 */
public record DagValidationError(Kind kind, String unitId, String dependency) {

    public enum Kind {
        MISSING_DEPENDENCY,
        SELF_DEPENDENCY
    }

    public String message() {
        return switch (kind) {
            case MISSING_DEPENDENCY -> unitId + " depends on non-existent unit: " + dependency;
            case SELF_DEPENDENCY -> unitId + " has self-dependency";
        };
    }
}
