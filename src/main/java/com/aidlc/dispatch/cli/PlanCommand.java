package com.aidlc.dispatch.cli;

import com.aidlc.core.config.VcsConfigResolver;
import com.aidlc.core.elaboration.ElaborationService;
import com.aidlc.core.elaboration.PlanReviewState;
import com.aidlc.core.model.VcsConfig;
import com.aidlc.core.store.IntentStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: aidlc plan &lt;intent&gt;
 * <p>
 * Without options, reports the plan review state. {@code --body} prints the plan pull request
 * body; {@code --create-pr} creates the plan branch and opens the pull request.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Plan review for an elaborated intent")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Intent slug")
    private String intentId;

    @Option(names = "--create-pr", description = "Create the plan branch and open its pull request")
    private boolean createPr;

    @Option(names = "--body", description = "Print the plan pull request body")
    private boolean body;

    private final VcsConfigResolver configResolver;
    private final ElaborationService elaboration;
    private final IntentStore intentStore;

    public PlanCommand(VcsConfigResolver configResolver, ElaborationService elaboration, IntentStore intentStore) {
        this.configResolver = configResolver;
        this.elaboration = elaboration;
        this.intentStore = intentStore;
    }

    @Override
    public Integer call() {
        if (intentStore.loadIntent(intentId).isEmpty()) {
            ConsoleOutput.error("Intent not found: " + intentId);
            return AidlcCommand.BAD_INPUT;
        }
        if (body) {
            ConsoleOutput.plain(elaboration.planPullRequestBody(intentId));
            return AidlcCommand.OK;
        }

        VcsConfig config = configResolver.resolve(intentId);
        if (createPr) {
            if (!config.elaborationReview()) {
                ConsoleOutput.warn("Plan review is disabled for " + intentId);
                return AidlcCommand.OK;
            }
            String branch = elaboration.createPlanBranch(intentId, config);
            String url = elaboration.createPlanPullRequest(intentId, config);
            ConsoleOutput.success("Plan PR for " + branch + ": " + url);
            return AidlcCommand.OK;
        }

        PlanReviewState state = elaboration.planReviewState(intentId);
        ConsoleOutput.plain("  branch: " + elaboration.planBranch(intentId));
        ConsoleOutput.plain("  review: " + state.state().name().toLowerCase(Locale.ROOT) + (state.url() != null ? " " + state.url() : ""));
        boolean allowed = elaboration.isConstructionAllowed(intentId, config);
        if (allowed) {
            ConsoleOutput.success("Construction may begin");
        } else {
            ConsoleOutput.warn("Construction waits for the plan PR to be merged");
        }
        return AidlcCommand.OK;
    }
}
