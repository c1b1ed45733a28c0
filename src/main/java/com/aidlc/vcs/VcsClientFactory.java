package com.aidlc.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Chooses the {@link VcsClient} for a repository. An explicit {@code git} or {@code jj} backend
 * wins; {@code auto} selects jj when the repository root holds a {@code .jj} directory.
 */
public class VcsClientFactory {

    private static final Logger log = LoggerFactory.getLogger(VcsClientFactory.class);

    private final CommandRunner runner;

    public VcsClientFactory(CommandRunner runner) {
        this.runner = runner;
    }

    public VcsClient create(Path repoRoot, String backend, String remote, Duration timeout) {
        VcsBackend selected = select(repoRoot, backend);
        log.debug("Using {} backend for {}", selected, repoRoot);
        return switch (selected) {
            case JJ -> new JjVcsClient(repoRoot, remote, runner, timeout);
            case GIT -> new GitVcsClient(repoRoot, remote, runner, timeout);
        };
    }

    static VcsBackend select(Path repoRoot, String backend) {
        String normalized = backend == null ? "auto" : backend.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "git" -> VcsBackend.GIT;
            case "jj" -> VcsBackend.JJ;
            case "auto" -> Files.isDirectory(repoRoot.resolve(".jj")) ? VcsBackend.JJ : VcsBackend.GIT;
            default -> throw new IllegalArgumentException(
                    "Unknown VCS backend '" + backend + "'. Must be: auto, git, or jj");
        };
    }
}
