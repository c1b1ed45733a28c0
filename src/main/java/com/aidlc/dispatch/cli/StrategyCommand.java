package com.aidlc.dispatch.cli;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.config.VcsConfigResolver;
import com.aidlc.core.integration.Integrator;
import com.aidlc.core.integration.IntegratorReadiness;
import com.aidlc.core.model.ChangeStrategy;
import com.aidlc.core.model.VcsConfig;
import com.aidlc.core.strategy.StrategyAdvisor;
import com.aidlc.core.strategy.StrategyPolicies;
import com.aidlc.core.strategy.StrategyRecommendation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: aidlc strategy [&lt;intent&gt;]
 * <p>
 * Shows the effective VCS configuration. Without an intent, shows the repository configuration
 * and a strategy recommendation.
 */
@Command(name = "strategy", mixinStandardHelpOptions = true, description = "Show the change strategy in effect")
@Component
public class StrategyCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Intent slug")
    private String intentId;

    private final VcsConfigResolver configResolver;
    private final StrategyPolicies policies;
    private final StrategyAdvisor advisor;
    private final Integrator integrator;
    private final AidlcProperties properties;

    public StrategyCommand(VcsConfigResolver configResolver, StrategyPolicies policies, StrategyAdvisor advisor,
                           Integrator integrator, AidlcProperties properties) {
        this.configResolver = configResolver;
        this.policies = policies;
        this.advisor = advisor;
        this.integrator = integrator;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        VcsConfig config = intentId != null ? configResolver.resolve(intentId) : configResolver.resolveRepository();

        ConsoleOutput.heading(intentId != null ? "Intent " + intentId : "Repository");
        ConsoleOutput.plain("  change_strategy:    " + config.changeStrategy());
        ConsoleOutput.plain("  default_branch:     " + config.defaultBranch());
        ConsoleOutput.plain("  elaboration_review: " + config.elaborationReview());
        ConsoleOutput.plain("  auto_merge:         " + (config.autoMerge() != null ? config.autoMerge() : "-"));
        ConsoleOutput.plain("  auto_squash:        " + (config.autoSquash() != null ? config.autoSquash() : "-"));

        Optional<ChangeStrategy> strategy = config.strategy();
        if (strategy.isEmpty()) {
            ConsoleOutput.error("Unknown change strategy: " + config.changeStrategy());
            return AidlcCommand.BAD_INPUT;
        }
        ConsoleOutput.plain("  " + policies.description(strategy.get()));

        IntegratorReadiness readiness = integrator.readiness(config.changeStrategy());
        ConsoleOutput.info("integration: " + readiness.reason());

        if (intentId == null) {
            StrategyRecommendation recommendation = advisor.recommend(properties.repoRootPath());
            ConsoleOutput.info("recommended: " + recommendation.strategy().value() + " - " + recommendation.reason());
        }
        return AidlcCommand.OK;
    }
}
