package com.aidlc.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * {@link VcsClient} over Jujutsu. Branches are bookmarks and worktrees are workspaces; pull
 * requests go through {@code gh} against the colocated git remote.
 */
public class JjVcsClient implements VcsClient {

    private static final Logger log = LoggerFactory.getLogger(JjVcsClient.class);

    private static final String BOOKMARKS_TEMPLATE = "bookmarks ++ \"\\n\"";
    private static final List<String> DEFAULT_BRANCH_CANDIDATES = List.of("main", "master", "trunk", "develop");

    private final Path repoRoot;
    private final String remote;
    private final CommandRunner runner;
    private final Duration timeout;
    private final GitHubCli gitHub;

    public JjVcsClient(Path repoRoot, String remote, CommandRunner runner, Duration timeout) {
        this(repoRoot, remote, runner, timeout, new GitHubCli(repoRoot, runner, timeout));
    }

    JjVcsClient(Path repoRoot, String remote, CommandRunner runner, Duration timeout, GitHubCli gitHub) {
        this.repoRoot = repoRoot;
        this.remote = remote;
        this.runner = runner;
        this.timeout = timeout;
        this.gitHub = gitHub;
    }

    @Override
    public VcsBackend backend() {
        return VcsBackend.JJ;
    }

    @Override
    public boolean branchExists(String name) {
        CommandResult result = runJj("bookmark", "list", name, "-T", "name ++ \"\\n\"");
        return result.succeeded() && result.output().lines().anyMatch(line -> line.trim().equals(name));
    }

    @Override
    public void createBranch(String name, String base) {
        CommandResult result = runJj("bookmark", "create", name, "-r", base);
        if (!result.succeeded()) {
            throw new VcsException("create-branch", "Could not create bookmark " + name + ": " + result.output());
        }
        log.info("Created bookmark {} at {}", name, base);
    }

    @Override
    public boolean isAncestor(String branch, String base) {
        String revset = quote(branch) + " & ::" + quote(base);
        CommandResult result = runJj("log", "-r", revset, "--no-graph", "-T", "commit_id ++ \"\\n\"");
        return result.succeeded() && !result.output().isBlank();
    }

    @Override
    public void deleteBranch(String name) {
        CommandResult result = runJj("bookmark", "delete", name);
        if (!result.succeeded()) {
            throw new VcsException("delete-branch", "Could not delete bookmark " + name + ": " + result.output());
        }
    }

    @Override
    public void checkout(String name) {
        CommandResult result = runJj("new", name);
        if (!result.succeeded()) {
            throw new VcsException("checkout", "Could not start a change on " + name + ": " + result.output());
        }
    }

    @Override
    public void push(String name) {
        CommandResult result = runJj("git", "push", "--bookmark", name, "--remote", remote);
        if (!result.succeeded()) {
            throw new VcsException("push", "Push of " + name + " failed: " + result.output());
        }
    }

    @Override
    public void pull(String name) {
        CommandResult result = runJj("git", "fetch", "--remote", remote);
        if (!result.succeeded()) {
            throw new VcsException("pull", "Fetch from " + remote + " failed: " + result.output());
        }
    }

    /**
     * Creates a merge change with the bookmarked working-copy parent and {@code branch} as
     * parents, then moves that bookmark onto it. Squashing is not applied: jj merges always keep
     * both parents.
     */
    @Override
    public void merge(String branch, boolean squash) {
        String target = currentBranch()
                .orElseThrow(() -> new VcsException("merge", "No bookmark on the working copy to merge into"));
        if (squash) {
            log.debug("Ignoring squash for jj merge of {}", branch);
        }
        CommandResult created = runJj("new", target, branch, "-m", "Merge " + branch);
        if (!created.succeeded()) {
            throw new VcsException("merge", "Merge of " + branch + " failed: " + created.output());
        }
        CommandResult moved = runJj("bookmark", "set", target, "-r", "@");
        if (!moved.succeeded()) {
            throw new VcsException("merge", "Could not move " + target + " onto the merge: " + moved.output());
        }
        log.info("Merged {} into {}", branch, target);
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
        // The working-copy commit rarely carries a bookmark; its parent usually does
        CommandResult result = runJj("log", "-r", "@ | @-", "--no-graph", "-T", BOOKMARKS_TEMPLATE);
        return result.succeeded() ? firstBookmark(result.output()) : Optional.empty();
    }

    @Override
    public String detectDefaultBranch() {
        CommandResult trunk = runJj("log", "-r", "trunk()", "--no-graph", "-T", BOOKMARKS_TEMPLATE);
        if (trunk.succeeded()) {
            Optional<String> bookmark = firstBookmark(trunk.output());
            if (bookmark.isPresent()) {
                return bookmark.get();
            }
        }
        for (String candidate : DEFAULT_BRANCH_CANDIDATES) {
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
        String workspace = path.getFileName().toString();
        CommandResult result = runJj("workspace", "forget", workspace);
        if (!result.succeeded()) {
            throw new VcsException("remove-workspace", "Could not forget workspace " + workspace + ": " + result.output());
        }
        try {
            FileSystemUtils.deleteRecursively(path);
        } catch (IOException e) {
            throw new VcsException("remove-workspace", "Could not delete " + path + ": " + e.getMessage(), e);
        }
        log.info("Removed workspace {}", workspace);
    }

    /**
     * First bookmark name in template output, without remote suffixes or the divergence marker.
     */
    static Optional<String> firstBookmark(String output) {
        return output.lines()
                .flatMap(line -> Arrays.stream(line.trim().split("\\s+")))
                .filter(token -> !token.isBlank())
                .map(token -> token.replaceAll("[*?]+$", ""))
                .map(token -> token.contains("@") ? token.substring(0, token.indexOf('@')) : token)
                .filter(token -> !token.isBlank())
                .findFirst();
    }

    private static String quote(String symbol) {
        return "\"" + symbol.replace("\"", "\\\"") + "\"";
    }

    CommandResult runJj(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("jj");
        command.addAll(List.of(args));
        try {
            return runner.run(repoRoot, timeout, command);
        } catch (CommandException e) {
            throw new VcsException(args[0], e.getMessage(), e);
        }
    }
}
