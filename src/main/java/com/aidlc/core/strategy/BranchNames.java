package com.aidlc.core.strategy;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses managed branch names ({@code root/intent[/unit[/bolt]]}) back into a {@link BranchContext}.
 */
public final class BranchNames {

    private BranchNames() {}

    public static Optional<BranchContext> parse(String root, String branch) {
        if (branch == null) {
            return Optional.empty();
        }
        Pattern pattern = Pattern.compile("^" + Pattern.quote(root) + "/([^/]+)(?:/([^/]+))?(?:/([^/]+))?$");
        Matcher m = pattern.matcher(branch);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new BranchContext(m.group(1), m.group(2), m.group(3)));
    }
}
