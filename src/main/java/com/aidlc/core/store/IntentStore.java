package com.aidlc.core.store;

import com.aidlc.core.model.Intent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable intent records keyed by intent slug.
 */
public interface IntentStore {

    Optional<Intent> loadIntent(String intentId);

    List<String> listIntents();

    /**
     * Sets {@code status} to completed and stamps {@code completed_at}. Leaves every other field
     * and all unit records untouched. Succeeds without writing when the intent is already completed.
     */
    StoreResult markCompleted(String intentId, Instant completedAt);
}
