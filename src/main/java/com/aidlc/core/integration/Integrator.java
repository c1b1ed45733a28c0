package com.aidlc.core.integration;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.dag.DagResolver;
import com.aidlc.core.logging.MdcContext;
import com.aidlc.core.metrics.IntegrationMetrics;
import com.aidlc.core.model.ChangeStrategy;
import com.aidlc.core.model.CleanupSummary;
import com.aidlc.core.model.Intent;
import com.aidlc.core.model.IntegrationResult;
import com.aidlc.core.model.Unit;
import com.aidlc.core.model.UnitStatus;
import com.aidlc.core.model.ValidationOutcome;
import com.aidlc.core.model.VcsConfig;
import com.aidlc.core.store.IntentStore;
import com.aidlc.core.store.MalformedRecordException;
import com.aidlc.core.store.RecordPathException;
import com.aidlc.core.store.StoreResult;
import com.aidlc.core.store.UnitStore;
import com.aidlc.core.strategy.BranchContext;
import com.aidlc.core.strategy.StrategyPolicies;
import com.aidlc.vcs.PullRequestInfo;
import com.aidlc.vcs.VcsClient;
import com.aidlc.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finishes an intent once every unit is complete, following its change strategy.
 * <p>
 * <ul>
 *   <li><b>trunk</b>: every unit branch must already be merged into the default branch, then the
 *       validation hooks run on the integrated result.</li>
 *   <li><b>intent</b>: the intent branch is pushed and a single pull request is opened. Completion
 *       waits for {@link #completeAfterApproval}.</li>
 *   <li><b>unit</b> / <b>bolt</b>: every unit branch must already be merged; no hooks run.</li>
 * </ul>
 * Every blocked outcome leaves the intent and unit records untouched, so a run can be retried.
 * Store and VCS failures come back as BLOCKED results; nothing is thrown to the caller.
 * Completion removes worktrees and unit branches, then marks the intent completed.
 */
@Service
public class Integrator {

    private static final Logger log = LoggerFactory.getLogger(Integrator.class);

    private final IntentStore intentStore;
    private final UnitStore unitStore;
    private final DagResolver dagResolver;
    private final VcsClient vcs;
    private final StrategyPolicies policies;
    private final ValidationHookRunner validation;
    private final WorkspaceCleaner cleaner;
    private final PullRequestBodyBuilder bodyBuilder;
    private final IntegrationMetrics metrics;
    private final Clock clock;
    private final Path repoRoot;
    private final String titlePrefix;

    public Integrator(IntentStore intentStore,
                      UnitStore unitStore,
                      DagResolver dagResolver,
                      VcsClient vcs,
                      StrategyPolicies policies,
                      ValidationHookRunner validation,
                      WorkspaceCleaner cleaner,
                      PullRequestBodyBuilder bodyBuilder,
                      IntegrationMetrics metrics,
                      Clock clock,
                      AidlcProperties properties) {
        this.intentStore = intentStore;
        this.unitStore = unitStore;
        this.dagResolver = dagResolver;
        this.vcs = vcs;
        this.policies = policies;
        this.validation = validation;
        this.cleaner = cleaner;
        this.bodyBuilder = bodyBuilder;
        this.metrics = metrics;
        this.clock = clock;
        this.repoRoot = properties.repoRootPath();
        this.titlePrefix = properties.getPullRequestTitlePrefix();
    }

    public IntegrationResult integrate(String intentId, VcsConfig config) {
        MdcContext.setStrategy(intentId, config.changeStrategy());
        long start = clock.millis();
        try {
            IntegrationResult result = doIntegrate(intentId, config);
            record(result, start);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Second half of the intent strategy, run once its pull request is approved: optionally merges
     * the PR, validates, cleans up and marks the intent completed. Other strategies are skipped.
     *
     * @param prNumber pull request to merge first, or null when it was merged elsewhere
     */
    public IntegrationResult completeAfterApproval(String intentId, VcsConfig config, Integer prNumber) {
        MdcContext.setStrategy(intentId, config.changeStrategy());
        long start = clock.millis();
        try {
            IntegrationResult result = doCompleteAfterApproval(intentId, config, prNumber);
            record(result, start);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    public IntegratorReadiness readiness(String strategy) {
        Optional<ChangeStrategy> parsed = ChangeStrategy.fromValue(strategy);
        if (parsed.isEmpty()) {
            return new IntegratorReadiness(false, "Unknown strategy: " + strategy);
        }
        return switch (parsed.get()) {
            case TRUNK -> new IntegratorReadiness(true, "Trunk strategy needs validation of auto-merged state");
            case INTENT -> new IntegratorReadiness(true, "Intent strategy needs single PR creation");
            case UNIT, BOLT -> new IntegratorReadiness(true, "Verifying all unit PRs were merged (lightweight check)");
        };
    }

    /**
     * Branch a unit's work lives on. Trunk, unit and bolt strategies all merge through it.
     */
    public String unitBranch(String intentSlug, Unit unit) {
        return policies.branchName(ChangeStrategy.UNIT, BranchContext.forUnit(intentSlug, unit.slug()));
    }

    private IntegrationResult doIntegrate(String intentId, VcsConfig config) {
        String strategyName = config.changeStrategy();
        Precondition pre = checkPreconditions(intentId, strategyName);
        if (pre.blocked() != null) {
            return pre.blocked();
        }
        if (pre.intent().isCompleted()) {
            log.info("Intent {} is already completed", intentId);
            return IntegrationResult.completed(strategyName,
                    "Intent '" + intentId + "' is already completed.", CleanupSummary.EMPTY);
        }

        Optional<ChangeStrategy> strategy = config.strategy();
        if (strategy.isEmpty()) {
            return IntegrationResult.blocked(strategyName,
                    "Unknown change strategy: " + strategyName,
                    List.of("Invalid strategy: " + strategyName));
        }

        log.info("Integrating intent {} with {} strategy ({} units)", intentId, strategyName, pre.units().size());
        return switch (strategy.get()) {
            case TRUNK -> integrateTrunk(pre.intent(), pre.units(), config);
            case INTENT -> integrateIntent(pre.intent(), pre.units(), config);
            case UNIT, BOLT -> integrateUnitOrBolt(pre.intent(), pre.units(), config);
        };
    }

    private IntegrationResult doCompleteAfterApproval(String intentId, VcsConfig config, Integer prNumber) {
        String strategyName = config.changeStrategy();
        Precondition pre = checkPreconditions(intentId, strategyName);
        if (pre.blocked() != null) {
            return pre.blocked();
        }
        if (config.strategy().filter(s -> s == ChangeStrategy.INTENT).isEmpty()) {
            return IntegrationResult.skipped(strategyName, "completeAfterApproval only applies to intent strategy");
        }
        if (pre.intent().isCompleted()) {
            return IntegrationResult.completed(strategyName,
                    "Intent '" + intentId + "' is already completed.", CleanupSummary.EMPTY);
        }

        if (prNumber != null) {
            try {
                vcs.mergePullRequest(prNumber);
                log.info("Merged pull request #{}", prNumber);
            } catch (VcsException e) {
                log.error("Merge of pull request #{} failed", prNumber, e);
                return IntegrationResult.blocked(strategyName, "Failed to merge PR",
                        List.of("Merge failed: " + e.getMessage()));
            }
        }

        ValidationOutcome outcome = runValidation();
        if (!outcome.passed()) {
            return IntegrationResult.blocked(strategyName, "Post-merge validation failed", outcome.errors());
        }
        return finish(pre.intent(), pre.units(), strategyName, "Intent '" + intentId + "' completed and merged.");
    }

    private IntegrationResult integrateTrunk(Intent intent, List<Unit> units, VcsConfig config) {
        String strategy = config.changeStrategy();
        List<String> unmerged;
        try {
            unmerged = unmergedBranches(intent.slug(), units, config.defaultBranch());
        } catch (VcsException e) {
            return verificationFailed(strategy, e);
        }
        if (!unmerged.isEmpty()) {
            return IntegrationResult.blocked(strategy, "Some unit branches were not merged to " + config.defaultBranch(),
                    unmerged.stream().map(b -> "Branch not merged: " + b).toList());
        }

        ValidationOutcome outcome = runValidation();
        if (!outcome.passed()) {
            return IntegrationResult.blocked(strategy, "Validation failed on integrated " + config.defaultBranch() + " branch",
                    outcome.errors());
        }
        return finish(intent, units, strategy,
                "Intent '" + intent.slug() + "' completed. All " + units.size() + " units merged and validated.");
    }

    private IntegrationResult integrateIntent(Intent intent, List<Unit> units, VcsConfig config) {
        String strategy = config.changeStrategy();
        String branch = policies.branchName(ChangeStrategy.INTENT, BranchContext.forIntent(intent.slug()));

        try {
            vcs.checkout(branch);
        } catch (VcsException e) {
            log.error("Checkout of {} failed", branch, e);
            return IntegrationResult.blocked(strategy, "Failed to checkout intent branch: " + branch,
                    List.of("Could not checkout branch: " + e.getMessage()));
        }

        try {
            vcs.push(branch);
        } catch (VcsException e) {
            log.error("Push of {} failed", branch, e);
            return IntegrationResult.blocked(strategy, "Failed to push intent branch",
                    List.of("Push failed: " + e.getMessage()));
        }

        Optional<PullRequestInfo> open = openPullRequest(branch);
        if (open.isPresent()) {
            log.info("Pull request {} for intent {} is already open", open.get().url(), intent.slug());
            return IntegrationResult.prCreated(strategy,
                    "PR already open for intent '" + intent.slug() + "'. Awaiting approval.", open.get().url());
        }

        String body = bodyBuilder.build(intent, units.stream().map(Unit::id).toList());
        String url;
        try {
            url = vcs.createPullRequest(branch, "[" + titlePrefix + "] " + intent.slug(), body, config.defaultBranch());
        } catch (VcsException e) {
            log.error("Pull request creation for {} failed", branch, e);
            return IntegrationResult.blocked(strategy, "Failed to create PR for intent",
                    List.of("PR creation failed: " + e.getMessage()));
        }

        log.info("Opened pull request {} for intent {}", url, intent.slug());
        return IntegrationResult.prCreated(strategy,
                "PR created for intent '" + intent.slug() + "'. Awaiting approval.", url);
    }

    private IntegrationResult integrateUnitOrBolt(Intent intent, List<Unit> units, VcsConfig config) {
        String strategy = config.changeStrategy();
        List<String> unmerged;
        try {
            unmerged = unmergedBranches(intent.slug(), units, config.defaultBranch());
        } catch (VcsException e) {
            return verificationFailed(strategy, e);
        }
        if (!unmerged.isEmpty()) {
            return IntegrationResult.blocked(strategy, "Some unit PRs may not have been merged",
                    unmerged.stream().map(b -> "Branch not merged: " + b).toList());
        }
        return finish(intent, units, strategy,
                "Intent '" + intent.slug() + "' completed. All " + units.size() + " unit PRs were merged.");
    }

    /**
     * The open pull request for {@code branch} left by an earlier run. A failed lookup is treated
     * as none, so creation is attempted and reports its own error.
     */
    private Optional<PullRequestInfo> openPullRequest(String branch) {
        try {
            return vcs.pullRequestFor(branch).filter(pr -> pr.state() == PullRequestInfo.State.OPEN);
        } catch (VcsException e) {
            log.warn("Could not look up pull requests for {}: {}", branch, e.getMessage());
            return Optional.empty();
        }
    }

    private IntegrationResult verificationFailed(String strategy, VcsException e) {
        log.error("Merge verification failed at {}", e.operation(), e);
        return IntegrationResult.blocked(strategy, "Cannot integrate: merge verification failed",
                List.of("Merge verification failed: " + e.getMessage()));
    }

    /**
     * Unit branches not reachable from {@code base}. A branch that no longer exists was removed by
     * an earlier cleanup, which only runs after it was verified merged.
     */
    private List<String> unmergedBranches(String intentSlug, List<Unit> units, String base) {
        var unmerged = new ArrayList<String>();
        for (Unit unit : units) {
            String branch = unitBranch(intentSlug, unit);
            if (!vcs.branchExists(branch)) {
                log.debug("Branch {} is gone, treating as integrated", branch);
                continue;
            }
            if (!vcs.isAncestor(branch, base)) {
                unmerged.add(branch);
            }
        }
        if (!unmerged.isEmpty()) {
            log.warn("Unmerged unit branches: {}", unmerged);
        }
        return unmerged;
    }

    private ValidationOutcome runValidation() {
        ValidationOutcome outcome = validation.run(repoRoot);
        metrics.recordValidation(outcome.passed());
        return outcome;
    }

    private IntegrationResult finish(Intent intent, List<Unit> units, String strategy, String message) {
        CleanupSummary cleanup = cleaner.cleanup(intent.slug(), units, this::unitBranch);
        metrics.recordCleanup(cleanup.branchesDeleted().size(), cleanup.worktreesRemoved().size());

        StoreResult marked = intentStore.markCompleted(intent.slug(), clock.instant());
        if (!marked.success()) {
            log.error("Could not mark intent {} completed: {}", intent.slug(), marked.message());
            return IntegrationResult.blocked(strategy, "Failed to mark intent complete", List.of(marked.message()));
        }
        log.info(message);
        return IntegrationResult.completed(strategy, message, cleanup);
    }

    private Precondition checkPreconditions(String intentId, String strategy) {
        Optional<Intent> intent;
        List<Unit> units;
        try {
            intent = intentStore.loadIntent(intentId);
            units = intent.isEmpty() ? List.of() : unitStore.loadUnits(intentId);
        } catch (MalformedRecordException | RecordPathException | UncheckedIOException e) {
            log.error("Records of intent {} cannot be read", intentId, e);
            return Precondition.blocked(IntegrationResult.blocked(strategy,
                    "Cannot integrate: records are unreadable", List.of(e.getMessage())));
        }
        if (intent.isEmpty()) {
            return Precondition.blocked(IntegrationResult.blocked(strategy,
                    "Cannot integrate: intent not found", List.of("Intent not found: " + intentId)));
        }
        if (units.isEmpty()) {
            return Precondition.blocked(IntegrationResult.blocked(strategy,
                    "Cannot integrate: intent has no units", List.of("No units defined for intent " + intentId)));
        }
        if (!dagResolver.isComplete(units)) {
            long open = units.stream().filter(u -> u.status() != UnitStatus.COMPLETED).count();
            log.info("Intent {} has {} unit(s) not completed", intentId, open);
            return Precondition.blocked(IntegrationResult.blocked(strategy,
                    "Cannot integrate: not all units are complete",
                    List.of("DAG is not complete - some units still pending or blocked")));
        }
        return new Precondition(intent.get(), units, null);
    }

    private void record(IntegrationResult result, long start) {
        String strategy = String.valueOf(result.strategy());
        metrics.recordIntegration(strategy, result.status().name().toLowerCase(Locale.ROOT));
        metrics.recordIntegrationDuration(strategy, clock.millis() - start);
    }

    private record Precondition(Intent intent, List<Unit> units, IntegrationResult blocked) {
        static Precondition blocked(IntegrationResult result) {
            return new Precondition(null, null, result);
        }
    }
}
