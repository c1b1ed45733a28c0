package com.aidlc.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link VcsClient} over the {@code git} CLI, with pull requests through {@code gh}.
 */
public class GitVcsClient implements VcsClient {

    private static final Logger log = LoggerFactory.getLogger(GitVcsClient.class);

    private final Path repoRoot;
    private final String remote;
    private final CommandRunner runner;
    private final Duration timeout;
    private final GitHubCli gitHub;

    public GitVcsClient(Path repoRoot, String remote, CommandRunner runner, Duration timeout) {
        this(repoRoot, remote, runner, timeout, new GitHubCli(repoRoot, runner, timeout));
    }

    GitVcsClient(Path repoRoot, String remote, CommandRunner runner, Duration timeout, GitHubCli gitHub) {
        this.repoRoot = repoRoot;
        this.remote = remote;
        this.runner = runner;
        this.timeout = timeout;
        this.gitHub = gitHub;
    }

    @Override
    public VcsBackend backend() {
        return VcsBackend.GIT;
    }

    @Override
    public boolean branchExists(String name) {
        return runGit("rev-parse", "--verify", "--quiet", "refs/heads/" + name).succeeded();
    }

    @Override
    public void createBranch(String name, String base) {
        CommandResult result = runGit("branch", name, base);
        if (!result.succeeded()) {
            throw new VcsException("create-branch", "Could not create branch " + name + ": " + result.output());
        }
        log.info("Created branch {} from {}", name, base);
    }

    @Override
    public boolean isAncestor(String branch, String base) {
        CommandResult result = runGit("merge-base", "--is-ancestor", branch, base);
        if (result.exitCode() > 1 || result.timedOut()) {
            log.debug("merge-base failed for {} against {}: {}", branch, base, result.output());
        }
        return result.succeeded();
    }

    @Override
    public void deleteBranch(String name) {
        CommandResult result = runGit("branch", "-d", name);
        if (!result.succeeded()) {
            throw new VcsException("delete-branch", "Could not delete branch " + name + ": " + result.output());
        }
    }

    @Override
    public void checkout(String name) {
        CommandResult result = runGit("checkout", name);
        if (!result.succeeded()) {
            throw new VcsException("checkout", "Could not checkout branch " + name + ": " + result.output());
        }
    }

    @Override
    public void push(String name) {
        CommandResult result = runGit("push", "-u", remote, name);
        if (!result.succeeded()) {
            throw new VcsException("push", "Push of " + name + " failed: " + result.output());
        }
    }

    @Override
    public void pull(String name) {
        CommandResult result = runGit("pull", remote, name);
        if (!result.succeeded()) {
            throw new VcsException("pull", "Pull of " + name + " failed: " + result.output());
        }
    }

    @Override
    public void merge(String branch, boolean squash) {
        CommandResult result = runGit("merge", squash ? "--squash" : "--no-ff", branch);
        if (!result.succeeded()) {
            throw new VcsException("merge", "Merge of " + branch + " failed: " + result.output());
        }
        if (squash) {
            CommandResult commit = runGit("commit", "-m", "Merge " + branch + " (squashed)");
            if (!commit.succeeded()) {
                throw new VcsException("merge", "Squash commit of " + branch + " failed: " + commit.output());
            }
        }
        log.info("Merged {} into the current branch", branch);
    }

    @Override
    public String createPullRequest(String head, String title, String body, String base) {
        return gitHub.createPullRequest(head, title, body, base);
    }

    @Override
    public void mergePullRequest(int number) {
        gitHub.mergePullRequest(number);
    }

    @Override
    public Optional<PullRequestInfo> pullRequestFor(String headBranch) {
        return gitHub.pullRequestFor(headBranch);
    }

    @Override
    public Optional<String> currentBranch() {
        CommandResult result = runGit("branch", "--show-current");
        if (!result.succeeded() || result.output().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(result.output().trim());
    }

    @Override
    public String detectDefaultBranch() {
        CommandResult head = runGit("symbolic-ref", "--short", "refs/remotes/" + remote + "/HEAD");
        if (head.succeeded() && !head.output().isBlank()) {
            String ref = head.output().trim();
            String prefix = remote + "/";
            return ref.startsWith(prefix) ? ref.substring(prefix.length()) : ref;
        }
        for (String candidate : List.of("main", "master")) {
            if (branchExists(candidate)) {
                return candidate;
            }
        }
        return "main";
    }

    @Override
    public void removeWorkspace(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        CommandResult result = runGit("worktree", "remove", "--force", path.toString());
        if (!result.succeeded()) {
            throw new VcsException("remove-worktree", "Could not remove worktree " + path + ": " + result.output());
        }
        log.info("Removed worktree {}", path);
    }

    /**
     * Runs a git command in the repository root. Package-private so tests can intercept it.
     */
    CommandResult runGit(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        try {
            return runner.run(repoRoot, timeout, command);
        } catch (CommandException e) {
            throw new VcsException(args[0], e.getMessage(), e);
        }
    }
}
