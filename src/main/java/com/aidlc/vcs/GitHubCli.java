package com.aidlc.vcs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pull-request operations through the {@code gh} CLI. Shared by the git and jj clients since
 * jj repositories are colocated with a git remote.
 */
public class GitHubCli {

    private static final Logger log = LoggerFactory.getLogger(GitHubCli.class);

    private final Path repoRoot;
    private final CommandRunner runner;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GitHubCli(Path repoRoot, CommandRunner runner, Duration timeout) {
        this.repoRoot = repoRoot;
        this.runner = runner;
        this.timeout = timeout;
    }

    public String createPullRequest(String head, String title, String body, String base) {
        CommandResult result = gh("pr", "create", "--head", head, "--title", title, "--body", body, "--base", base);
        if (!result.succeeded()) {
            throw new VcsException("pr-create", "gh pr create failed: " + result.output());
        }
        // gh prints progress lines before the URL
        String[] lines = result.output().split("\\R");
        String url = lines[lines.length - 1].trim();
        log.info("Created pull request {}", url);
        return url;
    }

    public void mergePullRequest(int number) {
        CommandResult result = gh("pr", "merge", String.valueOf(number), "--merge");
        if (!result.succeeded()) {
            throw new VcsException("pr-merge", "gh pr merge " + number + " failed: " + result.output());
        }
    }

    public Optional<PullRequestInfo> pullRequestFor(String headBranch) {
        CommandResult result = gh("pr", "list", "--head", headBranch, "--state", "all",
                "--json", "number,url,state", "--limit", "1");
        if (!result.succeeded()) {
            throw new VcsException("pr-list", "gh pr list failed: " + result.output());
        }
        return parsePullRequestList(result.output());
    }

    Optional<PullRequestInfo> parsePullRequestList(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (!root.isArray() || root.isEmpty()) {
                return Optional.empty();
            }
            JsonNode pr = root.get(0);
            var state = PullRequestInfo.State.valueOf(pr.path("state").asText("OPEN").toUpperCase(Locale.ROOT));
            return Optional.of(new PullRequestInfo(pr.path("number").asInt(), pr.path("url").asText(), state));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new VcsException("pr-list", "Unreadable gh output: " + e.getMessage(), e);
        }
    }

    CommandResult gh(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("gh");
        command.addAll(List.of(args));
        try {
            return runner.run(repoRoot, timeout, command);
        } catch (CommandException e) {
            throw new VcsException(args.length > 1 ? "pr-" + args[1] : "gh", e.getMessage(), e);
        }
    }
}
