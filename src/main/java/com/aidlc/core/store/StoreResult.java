package com.aidlc.core.store;

/**
 * Outcome of a store mutation.
 *
 * @param success whether the record was written (or already in the requested state)
 * @param error   failure kind, null on success
 * @param message detail for the caller
 */
public record StoreResult(boolean success, StoreError error, String message) {

    public enum StoreError {
        INVALID_STATUS,
        NOT_FOUND,
        PATH_VIOLATION,
        IO_FAILURE
    }

    public static StoreResult ok(String message) {
        return new StoreResult(true, null, message);
    }

    public static StoreResult failure(StoreError error, String message) {
        return new StoreResult(false, error, message);
    }
}
