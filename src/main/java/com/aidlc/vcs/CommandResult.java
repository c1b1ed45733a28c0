package com.aidlc.vcs;

/**
 * Exit status and combined output of an external command.
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
