package com.aidlc.core.strategy;

public record PullRequestContext(boolean unitComplete, boolean boltComplete, boolean intentComplete) {
}
