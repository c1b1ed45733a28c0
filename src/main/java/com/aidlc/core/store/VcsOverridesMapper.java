package com.aidlc.core.store;

import com.aidlc.core.model.VcsOverrides;

import java.util.Map;

/**
 * Maps a {@code vcs:} block (snake_case keys) from frontmatter or a settings file to {@link VcsOverrides}.
 */
public final class VcsOverridesMapper {

    public static final String BLOCK_KEY = "vcs";

    private VcsOverridesMapper() {
    }

    public static VcsOverrides fromMap(Map<String, Object> block) {
        if (block == null || block.isEmpty()) {
            return VcsOverrides.NONE;
        }
        return new VcsOverrides(
                string(block.get("change_strategy")),
                bool("elaboration_review", block.get("elaboration_review")),
                string(block.get("default_branch")),
                bool("auto_merge", block.get("auto_merge")),
                bool("auto_squash", block.get("auto_squash")));
    }

    private static String string(Object value) {
        if (value == null) return null;
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? null : s;
    }

    private static Boolean bool(String key, Object value) {
        if (value == null) return null;
        if (value instanceof Boolean b) return b;
        String s = String.valueOf(value).trim();
        if (s.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (s.equalsIgnoreCase("false")) return Boolean.FALSE;
        throw new MalformedRecordException("Expected true or false for " + key + ", got: " + s);
    }
}
