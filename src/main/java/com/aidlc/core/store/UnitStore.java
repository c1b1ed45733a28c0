package com.aidlc.core.store;

import com.aidlc.core.model.Unit;

import java.util.List;
import java.util.Optional;

/**
 * Durable unit records keyed by {@code (intentId, unitId)}.
 */
public interface UnitStore {

    /**
     * All units of an intent, ordered by slug ordinal then id. Empty when the intent has none.
     */
    List<Unit> loadUnits(String intentId);

    Optional<Unit> loadUnit(String intentId, String unitId);

    /**
     * Replaces a unit's status. The record is staged in full and swapped in with one atomic move.
     *
     * @param newStatus stored status value: {@code pending}, {@code in_progress}, {@code completed} or {@code blocked}
     */
    StoreResult updateStatus(String intentId, String unitId, String newStatus);
}
