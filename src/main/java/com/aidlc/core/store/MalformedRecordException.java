package com.aidlc.core.store;

/**
 * Thrown when a stored record cannot be turned into a typed {@code Unit} or {@code Intent}.
 */
public class MalformedRecordException extends RuntimeException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
