package com.aidlc.dispatch.cli;

import com.aidlc.core.config.VcsConfigResolver;
import com.aidlc.core.integration.UnitMerger;
import com.aidlc.core.model.IntegrationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: aidlc merge &lt;intent&gt; &lt;unit&gt;
 * <p>
 * Auto-merges a finished unit into the default branch when the intent's strategy allows it.
 */
@Command(name = "merge", mixinStandardHelpOptions = true,
        description = "Validate a completed unit and merge it into the default branch")
@Component
public class MergeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Intent slug")
    private String intentId;

    @Parameters(index = "1", description = "Unit id, e.g. unit-02-api")
    private String unitId;

    private final VcsConfigResolver configResolver;
    private final UnitMerger merger;

    public MergeCommand(VcsConfigResolver configResolver, UnitMerger merger) {
        this.configResolver = configResolver;
        this.merger = merger;
    }

    @Override
    public Integer call() {
        IntegrationResult result = merger.merge(intentId, unitId, configResolver.resolve(intentId));
        ConsoleOutput.result(result);
        return result.status().isSuccess() ? AidlcCommand.OK : AidlcCommand.FAILED;
    }
}
