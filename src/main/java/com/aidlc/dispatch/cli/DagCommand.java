package com.aidlc.dispatch.cli;

import com.aidlc.core.dag.DagFormat;
import com.aidlc.core.dag.DagRenderer;
import com.aidlc.core.dag.DagResolver;
import com.aidlc.core.model.BlockedUnit;
import com.aidlc.core.model.DagClassification;
import com.aidlc.core.model.DagValidationError;
import com.aidlc.core.model.Unit;
import com.aidlc.core.store.IntentStore;
import com.aidlc.core.store.UnitStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: aidlc dag &lt;intent&gt;
 * <p>
 * Shows which units are ready, blocked, in progress or completed, plus a diagram.
 */
@Command(name = "dag", mixinStandardHelpOptions = true, description = "Show the unit dependency graph of an intent")
@Component
public class DagCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Intent slug")
    private String intentId;

    @Option(names = {"--format", "-f"}, description = "Diagram format: table, ascii or mermaid (default: ${DEFAULT-VALUE})",
            defaultValue = "table")
    private String format;

    @Option(names = "--validate", description = "Report missing and self dependencies; exit 1 if any")
    private boolean validate;

    private final IntentStore intentStore;
    private final UnitStore unitStore;
    private final DagResolver resolver;
    private final DagRenderer renderer;

    public DagCommand(IntentStore intentStore, UnitStore unitStore, DagResolver resolver, DagRenderer renderer) {
        this.intentStore = intentStore;
        this.unitStore = unitStore;
        this.resolver = resolver;
        this.renderer = renderer;
    }

    @Override
    public Integer call() {
        DagFormat diagram;
        try {
            diagram = DagFormat.valueOf(format.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Unknown format '" + format + "'. Must be: table, ascii, or mermaid");
            return AidlcCommand.BAD_INPUT;
        }
        if (intentStore.loadIntent(intentId).isEmpty()) {
            ConsoleOutput.error("Intent not found: " + intentId);
            return AidlcCommand.BAD_INPUT;
        }
        List<Unit> units = unitStore.loadUnits(intentId);

        DagClassification dag = resolver.classify(units);
        ConsoleOutput.heading("Intent " + intentId);
        ConsoleOutput.plain("  Ready:       " + joinOrDash(dag.ready()));
        ConsoleOutput.plain("  In progress: " + joinOrDash(dag.inProgress()));
        ConsoleOutput.plain("  Completed:   " + joinOrDash(dag.completed()));
        for (BlockedUnit blocked : dag.blocked()) {
            ConsoleOutput.plain("  Blocked:     " + blocked.unitId() + " <- " + joinOrDash(blocked.blockedBy()));
        }
        ConsoleOutput.plain("  Summary:     " + resolver.summary(units));
        ConsoleOutput.plain("");
        ConsoleOutput.plain(renderer.render(units, diagram));

        if (!validate) {
            return AidlcCommand.OK;
        }
        List<DagValidationError> errors = resolver.validate(units);
        if (errors.isEmpty()) {
            ConsoleOutput.success("No dependency errors");
            return AidlcCommand.OK;
        }
        errors.forEach(e -> ConsoleOutput.error(e.message()));
        return AidlcCommand.FAILED;
    }

    private static String joinOrDash(List<String> ids) {
        return ids.isEmpty() ? "-" : String.join(", ", ids);
    }
}
