package com.aidlc.vcs;

/**
 * Thrown when an external command cannot be started or waited for.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
