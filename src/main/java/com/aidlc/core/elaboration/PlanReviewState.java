package com.aidlc.core.elaboration;

import com.aidlc.vcs.PullRequestInfo;

/**
 * Review status of an intent's plan pull request.
 *
 * @param url    pull request URL, null when {@link State#NONE}
 * @param number pull request number, null when {@link State#NONE}
 */
public record PlanReviewState(State state, String url, Integer number) {

    public enum State {
        NONE,
        OPEN,
        MERGED,
        CLOSED
    }

    public static final PlanReviewState NONE = new PlanReviewState(State.NONE, null, null);

    public static PlanReviewState of(PullRequestInfo pr) {
        State state = switch (pr.state()) {
            case OPEN -> State.OPEN;
            case MERGED -> State.MERGED;
            case CLOSED -> State.CLOSED;
        };
        return new PlanReviewState(state, pr.url(), pr.number());
    }
}
