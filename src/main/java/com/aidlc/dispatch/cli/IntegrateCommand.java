package com.aidlc.dispatch.cli;

import com.aidlc.core.config.VcsConfigResolver;
import com.aidlc.core.integration.Integrator;
import com.aidlc.core.model.IntegrationResult;
import com.aidlc.core.strategy.ManagedBranchLocator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: aidlc integrate [&lt;intent&gt;]
 */
@Command(name = "integrate", mixinStandardHelpOptions = true,
        description = "Integrate a completed intent according to its change strategy")
@Component
public class IntegrateCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Intent slug; defaults to the intent of the current branch")
    private String intentId;

    private final VcsConfigResolver configResolver;
    private final Integrator integrator;
    private final ManagedBranchLocator locator;

    public IntegrateCommand(VcsConfigResolver configResolver, Integrator integrator, ManagedBranchLocator locator) {
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
        IntegrationResult result = integrator.integrate(intent, configResolver.resolve(intent));
        ConsoleOutput.result(result);
        return result.status().isSuccess() ? AidlcCommand.OK : AidlcCommand.FAILED;
    }
}
