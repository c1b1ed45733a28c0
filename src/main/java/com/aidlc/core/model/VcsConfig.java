package com.aidlc.core.model;

import java.util.Optional;

/**
 * Resolved VCS policy for one intent.
 *
 * @param changeStrategy    configured strategy name; may name an unknown strategy, see {@link #strategy()}
 * @param elaborationReview whether plans go through a review PR before construction
 * @param defaultBranch     concrete base branch; never {@code auto} once resolved
 * @param autoMerge         explicit auto-merge override, null when unset
 * @param autoSquash        explicit squash override, null when unset
 */
public record VcsConfig(
    String changeStrategy,
    boolean elaborationReview,
    String defaultBranch,
    Boolean autoMerge,
    Boolean autoSquash
) {

    public static VcsConfig of(ChangeStrategy strategy, String defaultBranch) {
        return new VcsConfig(strategy.value(), false, defaultBranch, null, null);
    }

    public Optional<ChangeStrategy> strategy() {
        return ChangeStrategy.fromValue(changeStrategy);
    }
}
