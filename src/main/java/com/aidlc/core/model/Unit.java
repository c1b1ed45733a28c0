package com.aidlc.core.model;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single work item within an intent.
 *
 * @param id          unique slug, e.g. {@code unit-03-session}
 * @param status      current lifecycle status
 * @param dependsOn   ids of units that must complete first (insertion-ordered, no duplicates)
 * @param branch      branch or bookmark once work has started, may be null
 * @param discipline  descriptive metadata (frontend, backend, ...), may be null
 * @param description first line of the unit's description section, may be null
 */
public record Unit(
    String id,
    UnitStatus status,
    List<String> dependsOn,
    String branch,
    String discipline,
    String description
) {

    private static final Pattern ORDINAL = Pattern.compile("^unit-(\\d+)-");

    public Unit {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static Unit of(String id, UnitStatus status, String... dependsOn) {
        return new Unit(id, status, List.of(dependsOn), null, null, null);
    }

    public Unit withStatus(UnitStatus newStatus) {
        return new Unit(id, newStatus, dependsOn, branch, discipline, description);
    }

    /**
     * Slug without the {@code unit-} prefix, e.g. {@code 03-session}. Used in branch and worktree names.
     */
    public String slug() {
        return id.startsWith("unit-") ? id.substring("unit-".length()) : id;
    }

    /**
     * Numeric ordinal from the slug prefix, or {@link Integer#MAX_VALUE} when the id carries none.
     */
    public int ordinal() {
        Matcher m = ORDINAL.matcher(id);
        if (!m.find()) return Integer.MAX_VALUE;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
