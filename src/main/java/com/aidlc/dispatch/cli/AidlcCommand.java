package com.aidlc.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for AI-DLC.
 * Exit codes: 0 on success, 1 when an operation is blocked or fails, 2 on bad input.
 */
@Command(
        name = "aidlc",
        mixinStandardHelpOptions = true,
        version = "aidlc 0.1.0",
        description = "Unit dependency graph and change integration for AI-DLC intents",
        subcommands = {
                IntentsCommand.class,
                DagCommand.class,
                UnitStatusCommand.class,
                HatCommand.class,
                StrategyCommand.class,
                BranchCommand.class,
                IntegrateCommand.class,
                MergeCommand.class,
                CompleteCommand.class,
                PlanCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AidlcCommand implements Runnable {

    static final int OK = CommandLine.ExitCode.OK;
    static final int FAILED = CommandLine.ExitCode.SOFTWARE;
    static final int BAD_INPUT = CommandLine.ExitCode.USAGE;

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
