package com.aidlc.dispatch.cli;

import com.aidlc.core.config.VcsConfigResolver;
import com.aidlc.core.integration.Integrator;
import com.aidlc.core.model.IntegrationResult;
import com.aidlc.core.strategy.ManagedBranchLocator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: aidlc complete [&lt;intent&gt;] [--pr N]
 * <p>
 * Finishes an intent-strategy intent after its pull request is approved.
 */
@Command(name = "complete", mixinStandardHelpOptions = true,
        description = "Complete an intent after its pull request was approved")
@Component
public class CompleteCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Intent slug; defaults to the intent of the current branch")
    private String intentId;

    @Option(names = "--pr", description = "Pull request number to merge first")
    private Integer prNumber;

    private final VcsConfigResolver configResolver;
    private final Integrator integrator;
    private final ManagedBranchLocator locator;

    public CompleteCommand(VcsConfigResolver configResolver, Integrator integrator, ManagedBranchLocator locator) {
        this.configResolver = configResolver;
        this.integrator = integrator;
        this.locator = locator;
    }

    @Override
    public Integer call() {
        String intent = intentId != null ? intentId : locator.currentIntent().orElse(null);
        if (intent == null) {
            ConsoleOutput.error("No intent given and the current branch is not an AI-DLC branch");
            return AidlcCommand.BAD_INPUT;
        }
        IntegrationResult result = integrator.completeAfterApproval(intent, configResolver.resolve(intent), prNumber);
        ConsoleOutput.result(result);
        return result.status().isSuccess() ? AidlcCommand.OK : AidlcCommand.FAILED;
    }
}
