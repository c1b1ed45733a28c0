package com.aidlc.dispatch.cli;

import com.aidlc.core.dag.DagResolver;
import com.aidlc.core.logging.MdcContext;
import com.aidlc.core.model.DagSummary;
import com.aidlc.core.model.Intent;
import com.aidlc.core.model.Unit;
import com.aidlc.core.phase.PhaseRecommender;
import com.aidlc.core.phase.WorkflowCatalog;
import com.aidlc.core.store.IntentStore;
import com.aidlc.core.store.UnitStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: aidlc hat &lt;intent&gt; [--workflow NAME]
 * <p>
 * Prints the workflow hat (phase) that should act next on the intent.
 */
@Command(name = "hat", mixinStandardHelpOptions = true, description = "Recommend the next workflow hat for an intent")
@Component
public class HatCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Intent slug")
    private String intentId;

    @Option(names = {"--workflow", "-w"}, description = "Use this workflow instead of the intent's own")
    private String workflowName;

    private final IntentStore intentStore;
    private final UnitStore unitStore;
    private final DagResolver resolver;
    private final PhaseRecommender recommender;
    private final WorkflowCatalog workflows;

    public HatCommand(IntentStore intentStore, UnitStore unitStore, DagResolver resolver,
                      PhaseRecommender recommender, WorkflowCatalog workflows) {
        this.intentStore = intentStore;
        this.unitStore = unitStore;
        this.resolver = resolver;
        this.recommender = recommender;
        this.workflows = workflows;
    }

    @Override
    public Integer call() {
        MdcContext.setIntent(intentId);
        try {
            return recommend();
        } finally {
            MdcContext.clear();
        }
    }

    private Integer recommend() {
        Optional<Intent> intent = intentStore.loadIntent(intentId);
        if (intent.isEmpty()) {
            ConsoleOutput.error("Intent not found: " + intentId);
            return AidlcCommand.BAD_INPUT;
        }
        WorkflowCatalog.Workflow workflow;
        if (workflowName != null) {
            Optional<WorkflowCatalog.Workflow> named = workflows.find(workflowName);
            if (named.isEmpty()) {
                ConsoleOutput.error("Unknown workflow '" + workflowName + "'. Available: "
                        + String.join(", ", workflows.workflows().keySet()));
                return AidlcCommand.BAD_INPUT;
            }
            workflow = named.get();
        } else {
            workflow = workflows.resolve(intent.get().workflow());
        }
        List<Unit> units = unitStore.loadUnits(intentId);
        DagSummary summary = resolver.summary(units);

        String hat = recommender.recommend(units.size(), summary, workflow.hats());
        ConsoleOutput.plain(hat);
        ConsoleOutput.info("workflow " + workflow.name() + " " + workflow.hats() + ", " + summary);
        return AidlcCommand.OK;
    }
}
