package com.aidlc.core.model;

/**
 * Unit counts for one intent at a point in time. Derived on every query, never stored.
 * <p>
 * {@code ready} and part of {@code blocked} partition the pending units; units whose own
 * status is BLOCKED are counted in {@code blocked} only.
 */
public record DagSummary(
    int pending,
    int inProgress,
    int completed,
    int blocked,
    int ready
) {

    public int total() {
        return pending + inProgress + completed + (blocked - blockedPendingShare());
    }

    private int blockedPendingShare() {
        return pending - ready;
    }

    @Override
    public String toString() {
        return "pending:" + pending + " in_progress:" + inProgress + " completed:" + completed
                + " blocked:" + blocked + " ready:" + ready;
    }
}
