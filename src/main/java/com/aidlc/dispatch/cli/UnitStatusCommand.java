package com.aidlc.dispatch.cli;

import com.aidlc.core.logging.MdcContext;
import com.aidlc.core.metrics.IntegrationMetrics;
import com.aidlc.core.store.StoreResult;
import com.aidlc.core.store.UnitStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: aidlc unit-status &lt;intent&gt; &lt;unit&gt; &lt;status&gt;
 */
@Command(name = "unit-status", mixinStandardHelpOptions = true, description = "Set the status of a unit")
@Component
public class UnitStatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Intent slug")
    private String intentId;

    @Parameters(index = "1", description = "Unit id, e.g. unit-02-api")
    private String unitId;

    @Parameters(index = "2", description = "pending, in_progress, completed or blocked")
    private String status;

    private final UnitStore unitStore;
    private final IntegrationMetrics metrics;

    public UnitStatusCommand(UnitStore unitStore, IntegrationMetrics metrics) {
        this.unitStore = unitStore;
        this.metrics = metrics;
    }

    @Override
    public Integer call() {
        MdcContext.setUnit(intentId, unitId);
        try {
            return update();
        } finally {
            MdcContext.clear();
        }
    }

    private Integer update() {
        StoreResult result = unitStore.updateStatus(intentId, unitId, status);
        if (result.success()) {
            metrics.recordStatusChange(status);
            ConsoleOutput.success(result.message());
            return AidlcCommand.OK;
        }
        ConsoleOutput.error(result.message());
        return result.error() == StoreResult.StoreError.IO_FAILURE ? AidlcCommand.FAILED : AidlcCommand.BAD_INPUT;
    }
}
