package com.aidlc.core.store;

/**
 * Thrown when an intent or unit id would resolve outside the records namespace.
 */
public class RecordPathException extends RuntimeException {

    public RecordPathException(String message) {
        super(message);
    }
}
