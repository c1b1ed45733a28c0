package com.aidlc.core.model;

import java.util.List;

/**
 * Result of running the project's validation hooks (tests, lint, type checks).
 */
public record ValidationOutcome(boolean passed, List<String> errors) {

    public static final ValidationOutcome PASSED = new ValidationOutcome(true, List.of());

    public ValidationOutcome {
        errors = List.copyOf(errors);
    }

    public static ValidationOutcome of(List<String> errors) {
        return new ValidationOutcome(errors.isEmpty(), errors);
    }
}
