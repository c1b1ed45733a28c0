package com.aidlc.vcs;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Branch, merge and pull-request operations against the repository being managed.
 * Implementations raise {@link VcsException} when an operation fails.
 */
public interface VcsClient {

    VcsBackend backend();

    boolean branchExists(String name);

    /**
     * Creates {@code name} pointing at {@code base}.
     */
    void createBranch(String name, String base);

    /**
     * Whether every commit of {@code branch} is reachable from {@code base}. Any failure to
     * answer is reported as {@code false}.
     */
    boolean isAncestor(String branch, String base);

    void deleteBranch(String name);

    void checkout(String name);

    void push(String name);

    void pull(String name);

    /**
     * Merges {@code branch} into the current branch with a merge commit, or as one squashed
     * commit when {@code squash} is set.
     */
    void merge(String branch, boolean squash);

    /**
     * Opens a pull request from {@code head} into {@code base}. The head is named explicitly since
     * a jj working copy leaves git without a current branch.
     *
     * @return the pull request URL
     */
    String createPullRequest(String head, String title, String body, String base);

    void mergePullRequest(int number);

    /**
     * Most recent pull request whose head is {@code headBranch}, in any state.
     */
    Optional<PullRequestInfo> pullRequestFor(String headBranch);

    Optional<String> currentBranch();

    /**
     * The repository's default branch: the remote HEAD symbol, then {@code main} or
     * {@code master} when present locally, else {@code main}.
     */
    String detectDefaultBranch();

    /**
     * Removes a secondary working copy (worktree or workspace). Absent paths are a no-op.
     */
    void removeWorkspace(Path path);
}
