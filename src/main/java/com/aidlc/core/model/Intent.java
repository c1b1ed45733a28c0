package com.aidlc.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A decomposed feature request tracked as one lifecycle entity.
 *
 * @param slug         directory name under the records root
 * @param title        first heading of the intent document
 * @param problem      body of the Problem section, may be null
 * @param solution     body of the Solution section, may be null
 * @param criteria     acceptance statements in document order
 * @param workflow     name of the workflow (hat list), may be null for the default
 * @param status       ACTIVE until integration marks it COMPLETED
 * @param created      creation time, may be null
 * @param completedAt  completion time, null while active
 * @param vcsOverrides per-intent VCS settings, highest precedence during resolution
 */
public record Intent(
    String slug,
    String title,
    String problem,
    String solution,
    List<String> criteria,
    String workflow,
    IntentStatus status,
    Instant created,
    Instant completedAt,
    VcsOverrides vcsOverrides
) {

    public Intent {
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
        vcsOverrides = vcsOverrides == null ? VcsOverrides.NONE : vcsOverrides;
    }

    public boolean isCompleted() {
        return status == IntentStatus.COMPLETED;
    }
}
