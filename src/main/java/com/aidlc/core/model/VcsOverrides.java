package com.aidlc.core.model;

/**
 * One layer of VCS settings as written in a settings file or intent frontmatter.
 * Every field is nullable; null means "not set at this layer".
 */
public record VcsOverrides(
    String changeStrategy,
    Boolean elaborationReview,
    String defaultBranch,
    Boolean autoMerge,
    Boolean autoSquash
) {

    public static final VcsOverrides NONE = new VcsOverrides(null, null, null, null, null);

    /**
     * Returns a copy where every field unset here is taken from {@code lower}.
     */
    public VcsOverrides over(VcsOverrides lower) {
        return new VcsOverrides(
                changeStrategy != null ? changeStrategy : lower.changeStrategy,
                elaborationReview != null ? elaborationReview : lower.elaborationReview,
                defaultBranch != null ? defaultBranch : lower.defaultBranch,
                autoMerge != null ? autoMerge : lower.autoMerge,
                autoSquash != null ? autoSquash : lower.autoSquash);
    }
}
