package com.aidlc.dispatch.cli;

import com.aidlc.core.dag.DagResolver;
import com.aidlc.core.model.Intent;
import com.aidlc.core.model.IntentStatus;
import com.aidlc.core.store.IntentStore;
import com.aidlc.core.store.UnitStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: aidlc intents [--active]
 */
@Command(name = "intents", mixinStandardHelpOptions = true, description = "List intents with their unit counts")
@Component
public class IntentsCommand implements Callable<Integer> {

    @Option(names = "--active", description = "Only list intents that are not completed")
    private boolean activeOnly;

    private final IntentStore intentStore;
    private final UnitStore unitStore;
    private final DagResolver resolver;

    public IntentsCommand(IntentStore intentStore, UnitStore unitStore, DagResolver resolver) {
        this.intentStore = intentStore;
        this.unitStore = unitStore;
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        List<String> ids = intentStore.listIntents();
        int shown = 0;
        for (String id : ids) {
            Optional<Intent> intent = intentStore.loadIntent(id);
            if (intent.isEmpty()) {
                continue;
            }
            if (activeOnly && intent.get().isCompleted()) {
                continue;
            }
            IntentStatus status = intent.get().status();
            ConsoleOutput.plain(String.format("  %-30s %-10s %s",
                    id, status == null ? "-" : status.value(), resolver.summary(unitStore.loadUnits(id))));
            shown++;
        }
        if (shown == 0) {
            ConsoleOutput.info("No intents found.");
        }
        return AidlcCommand.OK;
    }
}
