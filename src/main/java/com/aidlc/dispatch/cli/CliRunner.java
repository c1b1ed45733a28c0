package com.aidlc.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AidlcCommand aidlcCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AidlcCommand aidlcCommand, IFactory factory) {
        this.aidlcCommand = aidlcCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(aidlcCommand, factory)
                .setExecutionExceptionHandler(new CliExceptionHandler())
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
