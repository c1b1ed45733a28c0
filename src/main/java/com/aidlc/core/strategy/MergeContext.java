package com.aidlc.core.strategy;

/**
 * Inputs to the auto-merge decision.
 *
 * @param autoMergeOverride explicit configuration value, null when unset
 */
public record MergeContext(boolean validationPassed, boolean unitComplete, Boolean autoMergeOverride) {
}
