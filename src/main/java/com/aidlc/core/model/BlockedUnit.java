package com.aidlc.core.model;

import java.util.List;

/**
 * A unit that cannot start, with the dependencies it is still waiting on.
 */
public record BlockedUnit(String unitId, List<String> blockedBy) {

    public BlockedUnit {
        blockedBy = List.copyOf(blockedBy);
    }
}
