package com.aidlc.core.strategy;

import com.aidlc.core.model.ChangeStrategy;

public record StrategyRecommendation(ChangeStrategy strategy, String reason) {
}
