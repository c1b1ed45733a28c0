package com.aidlc.core.strategy;

/**
 * What a branch is for. {@code unit} is a unit slug without the {@code unit-} prefix; {@code unit}
 * and {@code bolt} may be null.
 */
public record BranchContext(String intent, String unit, String bolt) {

    public static BranchContext forIntent(String intent) {
        return new BranchContext(intent, null, null);
    }

    public static BranchContext forUnit(String intent, String unit) {
        return new BranchContext(intent, unit, null);
    }
}
