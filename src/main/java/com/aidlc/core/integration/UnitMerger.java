package com.aidlc.core.integration;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.logging.MdcContext;
import com.aidlc.core.metrics.IntegrationMetrics;
import com.aidlc.core.model.ChangeStrategy;
import com.aidlc.core.model.CleanupSummary;
import com.aidlc.core.model.IntegrationResult;
import com.aidlc.core.model.Unit;
import com.aidlc.core.model.UnitStatus;
import com.aidlc.core.model.ValidationOutcome;
import com.aidlc.core.model.VcsConfig;
import com.aidlc.core.store.MalformedRecordException;
import com.aidlc.core.store.RecordPathException;
import com.aidlc.core.store.UnitStore;
import com.aidlc.core.strategy.BranchContext;
import com.aidlc.core.strategy.MergeContext;
import com.aidlc.core.strategy.StrategyPolicies;
import com.aidlc.vcs.VcsClient;
import com.aidlc.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Auto-merges one finished unit branch into the default branch when the strategy allows it.
 * <p>
 * The unit branch is validated first, then the default branch is updated from the remote, the
 * unit merged in and the result pushed. The merged unit branch is deleted afterwards, best effort.
 * Store and VCS failures come back as BLOCKED results.
 */
@Service
public class UnitMerger {

    private static final Logger log = LoggerFactory.getLogger(UnitMerger.class);

    private final UnitStore unitStore;
    private final VcsClient vcs;
    private final StrategyPolicies policies;
    private final ValidationHookRunner validation;
    private final IntegrationMetrics metrics;
    private final Path repoRoot;

    public UnitMerger(UnitStore unitStore,
                      VcsClient vcs,
                      StrategyPolicies policies,
                      ValidationHookRunner validation,
                      IntegrationMetrics metrics,
                      AidlcProperties properties) {
        this.unitStore = unitStore;
        this.vcs = vcs;
        this.policies = policies;
        this.validation = validation;
        this.metrics = metrics;
        this.repoRoot = properties.repoRootPath();
    }

    public IntegrationResult merge(String intentId, String unitId, VcsConfig config) {
        MdcContext.setUnit(intentId, unitId);
        try {
            return doMerge(intentId, unitId, config);
        } finally {
            MdcContext.clear();
        }
    }

    private IntegrationResult doMerge(String intentId, String unitId, VcsConfig config) {
        String strategyName = config.changeStrategy();
        Optional<Unit> unit;
        try {
            unit = unitStore.loadUnit(intentId, unitId);
        } catch (MalformedRecordException | RecordPathException | UncheckedIOException e) {
            log.error("Unit {} of intent {} cannot be read", unitId, intentId, e);
            return IntegrationResult.blocked(strategyName, "Cannot merge: unit record is unreadable",
                    List.of(e.getMessage()));
        }
        if (unit.isEmpty()) {
            return IntegrationResult.blocked(strategyName, "Cannot merge: unit not found",
                    List.of("Unit not found: " + unitId));
        }
        Optional<ChangeStrategy> strategy = config.strategy();
        if (strategy.isEmpty()) {
            return IntegrationResult.blocked(strategyName, "Unknown change strategy: " + strategyName,
                    List.of("Invalid strategy: " + strategyName));
        }

        boolean unitComplete = unit.get().status() == UnitStatus.COMPLETED;
        // Validation has not run yet: ask whether a passing run could lead to a merge at all
        if (!policies.shouldAutoMerge(strategy.get(), new MergeContext(true, unitComplete, config.autoMerge()))) {
            return IntegrationResult.skipped(strategyName, skipReason(strategy.get(), unitId, unitComplete, config));
        }

        String branch = policies.branchName(ChangeStrategy.UNIT, BranchContext.forUnit(intentId, unit.get().slug()));
        try {
            if (!vcs.branchExists(branch)) {
                return IntegrationResult.blocked(strategyName, "Cannot merge: unit branch not found",
                        List.of("Branch not found: " + branch));
            }
            vcs.checkout(branch);
        } catch (VcsException e) {
            log.error("Preparing {} failed at {}", branch, e.operation(), e);
            return IntegrationResult.blocked(strategyName, "Failed to checkout unit branch: " + branch,
                    List.of("Could not checkout branch: " + e.getMessage()));
        }
        ValidationOutcome outcome = validation.run(repoRoot);
        metrics.recordValidation(outcome.passed());
        if (!outcome.passed()) {
            return IntegrationResult.blocked(strategyName, "Validation failed on " + branch, outcome.errors());
        }

        String base = config.defaultBranch();
        try {
            vcs.checkout(base);
            vcs.pull(base);
            vcs.merge(branch, Boolean.TRUE.equals(config.autoSquash()));
            vcs.push(base);
        } catch (VcsException e) {
            log.error("Auto-merge of {} into {} failed at {}", branch, base, e.operation(), e);
            return IntegrationResult.blocked(strategyName, "Failed to merge " + branch + " into " + base,
                    List.of(e.operation() + " failed: " + e.getMessage()));
        }

        var deleted = new ArrayList<String>();
        try {
            vcs.deleteBranch(branch);
            deleted.add(branch);
        } catch (VcsException e) {
            log.warn("Merged branch {} was not deleted: {}", branch, e.getMessage());
        }
        metrics.recordCleanup(deleted.size(), 0);

        String message = "Unit '" + unitId + "' merged into " + base + ".";
        log.info(message);
        return IntegrationResult.completed(strategyName, message, new CleanupSummary(deleted, List.of()));
    }

    private static String skipReason(ChangeStrategy strategy, String unitId, boolean unitComplete, VcsConfig config) {
        if (Boolean.FALSE.equals(config.autoMerge())) {
            return "Auto-merge is disabled";
        }
        if (strategy == ChangeStrategy.TRUNK && !unitComplete) {
            return "Unit '" + unitId + "' is not completed";
        }
        return strategy.value() + " strategy merges through pull requests";
    }
}
