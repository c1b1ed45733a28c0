package com.aidlc.core.strategy;

import com.aidlc.vcs.VcsClient;

import java.util.Optional;

/**
 * Works out which intent (and unit, bolt) the working copy is on from the checked-out branch name.
 */
public class ManagedBranchLocator {

    private final VcsClient vcs;
    private final StrategyPolicies policies;

    public ManagedBranchLocator(VcsClient vcs, StrategyPolicies policies) {
        this.vcs = vcs;
        this.policies = policies;
    }

    /**
     * Context of the current branch, or empty when detached or on a branch outside the managed prefix.
     */
    public Optional<BranchContext> current() {
        return vcs.currentBranch().flatMap(branch -> BranchNames.parse(policies.branchPrefix(), branch));
    }

    public Optional<String> currentIntent() {
        return current().map(BranchContext::intent);
    }
}
