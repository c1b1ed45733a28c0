package com.aidlc.core.model;

/**
 * Outcome of an integration run.
 */
public enum IntegrationStatus {
    COMPLETED,
    PR_CREATED,
    BLOCKED,
    SKIPPED;

    /**
     * Whether the caller should treat this outcome as a success (process exit code 0).
     */
    public boolean isSuccess() {
        return this != BLOCKED;
    }
}
