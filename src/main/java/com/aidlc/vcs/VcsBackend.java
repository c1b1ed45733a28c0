package com.aidlc.vcs;

/**
 * Version-control model in use for a repository.
 */
public enum VcsBackend {
    /** Branches and worktrees. */
    GIT,
    /** Jujutsu bookmarks and workspaces. */
    JJ
}
