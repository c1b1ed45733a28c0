package com.aidlc.core.integration;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.model.ValidationOutcome;
import com.aidlc.vcs.CommandException;
import com.aidlc.vcs.CommandResult;
import com.aidlc.vcs.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects the build tools a project uses from its build files and runs their check commands.
 * <p>
 * A build file that is absent, or whose tool is not on the PATH, contributes no check. Each
 * command that exits non-zero or exceeds the timeout contributes one error.
 */
@Component
public class CommandValidationHookRunner implements ValidationHookRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandValidationHookRunner.class);

    static final List<Check> CHECKS = List.of(
            new Check("package.json", "npm test", List.of("npm", "test", "--if-present")),
            new Check("package.json", "npm lint", List.of("npm", "run", "lint", "--if-present")),
            new Check("package.json", "npm typecheck", List.of("npm", "run", "typecheck", "--if-present")),
            new Check("Cargo.toml", "cargo test", List.of("cargo", "test")),
            new Check("Cargo.toml", "cargo clippy", List.of("cargo", "clippy")),
            new Check("pom.xml", "mvn test", List.of("mvn", "-B", "-q", "test"))
    );

    private final CommandRunner runner;
    private final Duration timeout;

    @Autowired
    public CommandValidationHookRunner(CommandRunner runner, AidlcProperties properties) {
        this(runner, Duration.ofSeconds(properties.getValidation().getTimeoutSeconds()));
    }

    CommandValidationHookRunner(CommandRunner runner, Duration timeout) {
        this.runner = runner;
        this.timeout = timeout;
    }

    @Override
    public ValidationOutcome run(Path repoRoot) {
        var errors = new ArrayList<String>();
        for (Check check : CHECKS) {
            if (!Files.exists(repoRoot.resolve(check.buildFile()))) {
                continue;
            }
            String tool = check.command().get(0);
            if (!runner.isOnPath(tool)) {
                log.info("Skipping {}: {} is not installed", check.name(), tool);
                continue;
            }
            log.info("Running {}", check.name());
            errors.addAll(execute(repoRoot, check));
        }
        if (errors.isEmpty()) {
            log.info("Validation passed");
        } else {
            log.warn("Validation failed: {}", errors);
        }
        return ValidationOutcome.of(errors);
    }

    private List<String> execute(Path repoRoot, Check check) {
        CommandResult result;
        try {
            result = runner.run(repoRoot, timeout, check.command());
        } catch (CommandException e) {
            return List.of(check.name() + " failed: " + e.getMessage());
        }
        if (result.timedOut()) {
            return List.of(check.name() + " timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            log.debug("{} output:\n{}", check.name(), result.output());
            return List.of(check.name() + " failed");
        }
        return List.of();
    }

    record Check(String buildFile, String name, List<String> command) {
    }
}
