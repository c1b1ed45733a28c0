package com.aidlc.core.strategy;

import com.aidlc.core.model.ChangeStrategy;

/**
 * Branch naming, pull-request and auto-merge rules of one change strategy.
 */
public interface StrategyPolicy {

    ChangeStrategy strategy();

    String branchName(BranchContext context);

    boolean shouldCreatePullRequest(PullRequestContext context);

    /**
     * The strategy's own merge rule. An explicit override is applied by
     * {@link StrategyPolicies#shouldAutoMerge(ChangeStrategy, MergeContext)}.
     */
    boolean shouldAutoMerge(MergeContext context);

    String description();
}
