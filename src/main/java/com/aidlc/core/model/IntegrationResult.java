package com.aidlc.core.model;

import java.util.List;

/**
 * Result of running the integrator for one intent. Returned to the caller, not persisted.
 *
 * @param status   outcome
 * @param strategy strategy name the run used (as configured)
 * @param message  human-readable summary
 * @param prUrl    pull request URL when one was created, otherwise null
 * @param errors   reasons when blocked; empty otherwise
 * @param cleanup  cleanup performed on completion, null when none ran
 */
public record IntegrationResult(
    IntegrationStatus status,
    String strategy,
    String message,
    String prUrl,
    List<String> errors,
    CleanupSummary cleanup
) {

    public IntegrationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static IntegrationResult completed(String strategy, String message, CleanupSummary cleanup) {
        return new IntegrationResult(IntegrationStatus.COMPLETED, strategy, message, null, List.of(), cleanup);
    }

    public static IntegrationResult prCreated(String strategy, String message, String prUrl) {
        return new IntegrationResult(IntegrationStatus.PR_CREATED, strategy, message, prUrl, List.of(), null);
    }

    public static IntegrationResult blocked(String strategy, String message, List<String> errors) {
        return new IntegrationResult(IntegrationStatus.BLOCKED, strategy, message, null, errors, null);
    }

    public static IntegrationResult skipped(String strategy, String message) {
        return new IntegrationResult(IntegrationStatus.SKIPPED, strategy, message, null, List.of(), null);
    }
}
