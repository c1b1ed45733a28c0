package com.aidlc.core.integration;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.model.CleanupSummary;
import com.aidlc.core.model.Unit;
import com.aidlc.vcs.VcsClient;
import com.aidlc.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Removes an intent's worktrees and unit branches once it is integrated.
 * <p>
 * Worktrees live under the worktree root as {@code ai-dlc-<intent>} and
 * {@code ai-dlc-<intent>-<unitSlug>}. Best effort: anything already gone counts as done, and a
 * failure to remove one item is logged and does not stop the rest.
 */
@Component
public class WorkspaceCleaner {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceCleaner.class);

    private static final String WORKTREE_PREFIX = "ai-dlc-";

    private final VcsClient vcs;
    private final Path worktreeRoot;

    @Autowired
    public WorkspaceCleaner(VcsClient vcs, AidlcProperties properties) {
        this(vcs, Path.of(properties.getWorktreeRoot()));
    }

    WorkspaceCleaner(VcsClient vcs, Path worktreeRoot) {
        this.vcs = vcs;
        this.worktreeRoot = worktreeRoot;
    }

    /**
     * @param unitBranch maps {@code (intent, unit)} to the unit's branch name
     */
    public CleanupSummary cleanup(String intentSlug, List<Unit> units, BiFunction<String, Unit, String> unitBranch) {
        var worktrees = new ArrayList<String>();
        var branches = new ArrayList<String>();

        removeWorktree(worktreeRoot.resolve(WORKTREE_PREFIX + intentSlug), worktrees);
        for (Unit unit : units) {
            removeWorktree(worktreeRoot.resolve(WORKTREE_PREFIX + intentSlug + "-" + unit.slug()), worktrees);
            deleteBranch(unitBranch.apply(intentSlug, unit), branches);
        }

        log.info("Cleanup for {} removed {} worktree(s) and {} branch(es)", intentSlug, worktrees.size(), branches.size());
        return new CleanupSummary(branches, worktrees);
    }

    private void removeWorktree(Path path, List<String> removed) {
        if (!Files.exists(path)) {
            return;
        }
        try {
            vcs.removeWorkspace(path);
            removed.add(path.toString());
        } catch (VcsException e) {
            log.warn("Could not remove worktree {}: {}", path, e.getMessage());
        }
    }

    private void deleteBranch(String branch, List<String> deleted) {
        try {
            if (!vcs.branchExists(branch)) {
                return;
            }
            vcs.deleteBranch(branch);
            deleted.add(branch);
        } catch (VcsException e) {
            log.warn("Could not delete branch {}: {}", branch, e.getMessage());
        }
    }
}
