package com.aidlc.core.strategy;

import com.aidlc.core.model.ChangeStrategy;
import com.aidlc.vcs.VcsClient;
import com.aidlc.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates managed branches idempotently: an existing branch is reused, and a create that fails
 * because another actor won the race counts as success.
 */
public class BranchProvisioner {

    private static final Logger log = LoggerFactory.getLogger(BranchProvisioner.class);

    private final VcsClient vcs;
    private final StrategyPolicies policies;

    public BranchProvisioner(VcsClient vcs, StrategyPolicies policies) {
        this.vcs = vcs;
        this.policies = policies;
    }

    /**
     * Ensures the strategy's branch for {@code context} exists, branching from {@code base} if not.
     *
     * @return the branch name
     */
    public String ensureBranch(ChangeStrategy strategy, BranchContext context, String base) {
        return ensureBranch(policies.branchName(strategy, context), base);
    }

    public String ensureBranch(String name, String base) {
        if (vcs.branchExists(name)) {
            log.debug("Branch {} already exists", name);
            return name;
        }
        try {
            vcs.createBranch(name, base);
        } catch (VcsException e) {
            if (vcs.branchExists(name)) {
                log.debug("Branch {} appeared concurrently", name);
                return name;
            }
            throw e;
        }
        return name;
    }
}
