package com.aidlc.vcs;

/**
 * A version-control operation failed. {@link #operation()} names the step, e.g. {@code push}.
 */
public class VcsException extends RuntimeException {

    private final String operation;

    public VcsException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public VcsException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
