package com.aidlc.core.elaboration;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.dag.DagFormat;
import com.aidlc.core.dag.DagRenderer;
import com.aidlc.core.model.Intent;
import com.aidlc.core.model.Unit;
import com.aidlc.core.model.VcsConfig;
import com.aidlc.core.store.IntentStore;
import com.aidlc.core.store.UnitStore;
import com.aidlc.core.strategy.BranchProvisioner;
import com.aidlc.vcs.VcsClient;
import com.aidlc.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Plan review before construction. The elaborated intent and its units go out on a
 * {@code <root>/<intent>/plan} branch as a pull request; construction may start once no plan
 * pull request is still open.
 */
@Service
public class ElaborationService {

    private static final Logger log = LoggerFactory.getLogger(ElaborationService.class);

    private final IntentStore intentStore;
    private final UnitStore unitStore;
    private final VcsClient vcs;
    private final BranchProvisioner provisioner;
    private final DagRenderer renderer;
    private final String branchPrefix;

    public ElaborationService(IntentStore intentStore,
                              UnitStore unitStore,
                              VcsClient vcs,
                              BranchProvisioner provisioner,
                              DagRenderer renderer,
                              AidlcProperties properties) {
        this.intentStore = intentStore;
        this.unitStore = unitStore;
        this.vcs = vcs;
        this.provisioner = provisioner;
        this.renderer = renderer;
        this.branchPrefix = properties.getBranchPrefix();
    }

    public String planBranch(String intentId) {
        return branchPrefix + "/" + intentId + "/plan";
    }

    /**
     * Creates the plan branch from the default branch if needed and checks it out.
     *
     * @throws VcsException if the branch cannot be created or checked out
     */
    public String createPlanBranch(String intentId, VcsConfig config) {
        String branch = provisioner.ensureBranch(planBranch(intentId), config.defaultBranch());
        vcs.checkout(branch);
        log.info("On plan branch {}", branch);
        return branch;
    }

    public String planPullRequestBody(String intentId) {
        Optional<Intent> intent = intentStore.loadIntent(intentId);
        List<Unit> units = unitStore.loadUnits(intentId);

        var lines = new ArrayList<String>();
        lines.add("## Summary");
        lines.add("");
        intent.ifPresent(i -> {
            if (i.problem() != null) {
                lines.add("### Problem");
                lines.add(i.problem());
                lines.add("");
            }
            if (i.solution() != null) {
                lines.add("### Solution");
                lines.add(i.solution());
                lines.add("");
            }
            if (i.workflow() != null) {
                lines.add("**Workflow:** " + i.workflow());
                lines.add("");
            }
        });

        lines.add("## Success Criteria");
        lines.add("");
        List<String> criteria = intent.map(Intent::criteria).orElse(List.of());
        if (criteria.isEmpty()) {
            lines.add("_See intent.md for criteria_");
        } else {
            criteria.forEach(c -> lines.add("- [ ] " + c));
        }
        lines.add("");

        if (!units.isEmpty()) {
            lines.add("## Units");
            lines.add("");
            lines.add("| Unit | Discipline | Dependencies |");
            lines.add("|------|------------|--------------|");
            for (Unit unit : units) {
                String deps = unit.dependsOn().isEmpty() ? "-"
                        : String.join(", ", unit.dependsOn().stream().map(d -> d.replaceFirst("^unit-", "")).toList());
                String discipline = unit.discipline() != null ? unit.discipline() : "-";
                lines.add("| " + unit.slug() + " | " + discipline + " | " + deps + " |");
            }
            lines.add("");
            lines.add("## Dependency Graph");
            lines.add("");
            lines.add(renderer.render(units, DagFormat.MERMAID));
            lines.add("");
        }

        lines.add("---");
        lines.add("");
        lines.add("_This plan was generated by AI-DLC elaboration. Review and merge to begin construction._");
        return String.join("\n", lines);
    }

    /**
     * Pushes the plan branch and opens its pull request against the default branch.
     *
     * @return the pull request URL
     * @throws VcsException if the push or pull request creation fails
     */
    public String createPlanPullRequest(String intentId, VcsConfig config) {
        String branch = planBranch(intentId);
        String title = intentStore.loadIntent(intentId)
                .map(Intent::title)
                .map(t -> "Plan: " + t)
                .orElse("Plan: " + intentId);

        vcs.push(branch);
        String url = vcs.createPullRequest(branch, title, planPullRequestBody(intentId), config.defaultBranch());
        log.info("Opened plan pull request {} for {}", url, intentId);
        return url;
    }

    /**
     * @throws VcsException if the hosting service cannot be queried
     */
    public PlanReviewState planReviewState(String intentId) {
        return vcs.pullRequestFor(planBranch(intentId))
                .map(PlanReviewState::of)
                .orElse(PlanReviewState.NONE);
    }

    /**
     * Construction is held back only while a plan pull request is open. When plan review is off,
     * or the hosting service cannot be reached, construction is allowed.
     */
    public boolean isConstructionAllowed(String intentId, VcsConfig config) {
        if (!config.elaborationReview()) {
            return true;
        }
        try {
            return planReviewState(intentId).state() != PlanReviewState.State.OPEN;
        } catch (VcsException e) {
            log.warn("Cannot query plan review for {}, allowing construction: {}", intentId, e.getMessage());
            return true;
        }
    }
}
