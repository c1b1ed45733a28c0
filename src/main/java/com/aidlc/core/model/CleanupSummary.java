package com.aidlc.core.model;

import java.util.List;

/**
 * Branches and worktrees removed while finishing an intent.
 */
public record CleanupSummary(List<String> branchesDeleted, List<String> worktreesRemoved) {

    public static final CleanupSummary EMPTY = new CleanupSummary(List.of(), List.of());

    public CleanupSummary {
        branchesDeleted = List.copyOf(branchesDeleted);
        worktreesRemoved = List.copyOf(worktreesRemoved);
    }
}
