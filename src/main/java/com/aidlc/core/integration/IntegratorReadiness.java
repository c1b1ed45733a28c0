package com.aidlc.core.integration;

/**
 * Whether integration applies to a strategy, and why.
 */
public record IntegratorReadiness(boolean shouldRun, String reason) {
}
