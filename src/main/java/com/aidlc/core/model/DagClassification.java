package com.aidlc.core.model;

import java.util.List;

/**
 * Units of one intent grouped by scheduling state. Each list keeps the input order.
 */
public record DagClassification(
    List<String> ready,
    List<BlockedUnit> blocked,
    List<String> inProgress,
    List<String> completed
) {

    public DagClassification {
        ready = List.copyOf(ready);
        blocked = List.copyOf(blocked);
        inProgress = List.copyOf(inProgress);
        completed = List.copyOf(completed);
    }

    public boolean isReady(String unitId) {
        return ready.contains(unitId);
    }

    public boolean isBlocked(String unitId) {
        return blocked.stream().anyMatch(b -> b.unitId().equals(unitId));
    }
}
