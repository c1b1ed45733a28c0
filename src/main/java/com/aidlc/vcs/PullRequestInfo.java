package com.aidlc.vcs;

/**
 * A pull request as reported by the hosting service.
 */
public record PullRequestInfo(int number, String url, State state) {

    public enum State {
        OPEN,
        MERGED,
        CLOSED
    }
}
