package com.aidlc.dispatch.cli;

import com.aidlc.core.config.VcsConfigResolver;
import com.aidlc.core.elaboration.ElaborationService;
import com.aidlc.core.model.ChangeStrategy;
import com.aidlc.core.model.Unit;
import com.aidlc.core.model.VcsConfig;
import com.aidlc.core.store.UnitStore;
import com.aidlc.core.strategy.BranchContext;
import com.aidlc.core.strategy.BranchProvisioner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: aidlc branch &lt;intent&gt; &lt;unit&gt; [--bolt N]
 * <p>
 * Ensures the working branch for a unit exists under the intent's strategy. Refused while the
 * intent's plan is still under review.
 */
@Command(name = "branch", mixinStandardHelpOptions = true, description = "Create the working branch for a unit")
@Component
public class BranchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Intent slug")
    private String intentId;

    @Parameters(index = "1", description = "Unit id, e.g. unit-02-api")
    private String unitId;

    @Option(names = "--bolt", description = "Bolt identifier (bolt strategy only)")
    private String bolt;

    private final VcsConfigResolver configResolver;
    private final UnitStore unitStore;
    private final BranchProvisioner provisioner;
    private final ElaborationService elaboration;

    public BranchCommand(VcsConfigResolver configResolver, UnitStore unitStore,
                         BranchProvisioner provisioner, ElaborationService elaboration) {
        this.configResolver = configResolver;
        this.unitStore = unitStore;
        this.provisioner = provisioner;
        this.elaboration = elaboration;
    }

    @Override
    public Integer call() {
        Optional<Unit> unit = unitStore.loadUnit(intentId, unitId);
        if (unit.isEmpty()) {
            ConsoleOutput.error("Unit not found: " + unitId);
            return AidlcCommand.BAD_INPUT;
        }
        VcsConfig config = configResolver.resolve(intentId);
        Optional<ChangeStrategy> strategy = config.strategy();
        if (strategy.isEmpty()) {
            ConsoleOutput.error("Unknown change strategy: " + config.changeStrategy());
            return AidlcCommand.BAD_INPUT;
        }
        if (!elaboration.isConstructionAllowed(intentId, config)) {
            ConsoleOutput.error("Plan for " + intentId + " is still under review: "
                    + elaboration.planReviewState(intentId).url());
            return AidlcCommand.FAILED;
        }

        var context = new BranchContext(intentId, unit.get().slug(), bolt);
        String branch = provisioner.ensureBranch(strategy.get(), context, config.defaultBranch());
        ConsoleOutput.success(branch);
        return AidlcCommand.OK;
    }
}
