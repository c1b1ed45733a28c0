package com.aidlc.core.strategy;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.model.ChangeStrategy;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * The fixed table of change strategies. Branch names are rooted at the configured prefix:
 * <pre>
 * trunk   {root}/{intent}/{unit}            PR never          merge iff valid and unit done
 * bolt    {root}/{intent}/{unit}[/{bolt}]   PR on bolt done   never
 * unit    {root}/{intent}/{unit}            PR on unit done   never
 * intent  {root}/{intent}                   PR on intent done never
 * </pre>
 */
@Component
public class StrategyPolicies {

    private final Map<ChangeStrategy, StrategyPolicy> policies = new EnumMap<>(ChangeStrategy.class);
    private final String root;

    public StrategyPolicies(AidlcProperties properties) {
        this.root = properties.getBranchPrefix();

        register(ChangeStrategy.TRUNK,
                "Ephemeral branches with auto-merge to trunk after each unit passes validation",
                ctx -> root + "/" + ctx.intent() + "/" + ctx.unit(),
                ctx -> false,
                ctx -> ctx.validationPassed() && ctx.unitComplete());
        register(ChangeStrategy.BOLT, "Fine-grained PRs per bolt, requiring manual review for each",
                ctx -> ctx.bolt() == null
                        ? root + "/" + ctx.intent() + "/" + ctx.unit()
                        : root + "/" + ctx.intent() + "/" + ctx.unit() + "/" + ctx.bolt(),
                PullRequestContext::boltComplete,
                ctx -> false);
        register(ChangeStrategy.UNIT, "Standard PRs per unit, balanced granularity for code review",
                ctx -> root + "/" + ctx.intent() + "/" + ctx.unit(),
                PullRequestContext::unitComplete,
                ctx -> false);
        register(ChangeStrategy.INTENT, "Single PR for entire intent, best for cohesive feature work",
                ctx -> root + "/" + ctx.intent(),
                PullRequestContext::intentComplete,
                ctx -> false);
    }

    public StrategyPolicy policy(ChangeStrategy strategy) {
        return policies.get(strategy);
    }

    public String branchPrefix() {
        return root;
    }

    public String branchName(ChangeStrategy strategy, BranchContext context) {
        return policy(strategy).branchName(context);
    }

    public boolean shouldCreatePullRequest(ChangeStrategy strategy, PullRequestContext context) {
        return policy(strategy).shouldCreatePullRequest(context);
    }

    /**
     * An explicit override wins: {@code true} merges iff validation passed, {@code false} never
     * merges. Without one the strategy's own rule applies.
     */
    public boolean shouldAutoMerge(ChangeStrategy strategy, MergeContext context) {
        if (context.autoMergeOverride() != null) {
            return context.autoMergeOverride() && context.validationPassed();
        }
        return policy(strategy).shouldAutoMerge(context);
    }

    public String description(ChangeStrategy strategy) {
        return policy(strategy).description();
    }

    private void register(ChangeStrategy strategy, String description,
                          Function<BranchContext, String> naming,
                          Predicate<PullRequestContext> pullRequest,
                          Predicate<MergeContext> merge) {
        policies.put(strategy, new TablePolicy(strategy, description, naming, pullRequest, merge));
    }

    private record TablePolicy(
        ChangeStrategy strategy,
        String description,
        Function<BranchContext, String> naming,
        Predicate<PullRequestContext> pullRequest,
        Predicate<MergeContext> merge
    ) implements StrategyPolicy {

        @Override
        public String branchName(BranchContext context) {
            return naming.apply(context);
        }

        @Override
        public boolean shouldCreatePullRequest(PullRequestContext context) {
            return pullRequest.test(context);
        }

        @Override
        public boolean shouldAutoMerge(MergeContext context) {
            return merge.test(context);
        }
    }
}
