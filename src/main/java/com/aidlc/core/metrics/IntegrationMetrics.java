package com.aidlc.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for integration runs and unit state changes.
 */
@Service
public class IntegrationMetrics {

    private final MeterRegistry registry;

    public IntegrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordIntegration(String strategy, String status) {
        Counter.builder("aidlc.integrations.total")
                .tag("strategy", strategy)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordIntegrationDuration(String strategy, long ms) {
        Timer.builder("aidlc.integration.duration")
                .tag("strategy", strategy)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordValidation(boolean passed) {
        Counter.builder("aidlc.validations.total")
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    /**
     * Counts branches and worktrees removed by integration cleanup.
     */
    public void recordCleanup(int branchesDeleted, int worktreesRemoved) {
        Counter.builder("aidlc.cleanup.branches")
                .description("Unit branches deleted after integration")
                .register(registry)
                .increment(branchesDeleted);
        Counter.builder("aidlc.cleanup.worktrees")
                .description("Worktrees removed after integration")
                .register(registry)
                .increment(worktreesRemoved);
    }

    public void recordStatusChange(String status) {
        Counter.builder("aidlc.unit.status_changes")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
