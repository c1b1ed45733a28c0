package com.aidlc.core.config;

import com.aidlc.core.phase.WorkflowCatalog;
import com.aidlc.core.store.FileIntentStore;
import com.aidlc.core.store.FileUnitStore;
import com.aidlc.core.store.IntentStore;
import com.aidlc.core.store.RecordPaths;
import com.aidlc.core.store.UnitStore;
import com.aidlc.core.strategy.BranchProvisioner;
import com.aidlc.core.strategy.ManagedBranchLocator;
import com.aidlc.core.strategy.StrategyPolicies;
import com.aidlc.vcs.CommandRunner;
import com.aidlc.vcs.VcsClient;
import com.aidlc.vcs.VcsClientFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AidlcConfig {

    @Bean
    public RecordPaths recordPaths(AidlcProperties properties) {
        return new RecordPaths(properties.recordsRootPath());
    }

    @Bean
    public UnitStore unitStore(RecordPaths paths) {
        return new FileUnitStore(paths);
    }

    @Bean
    public IntentStore intentStore(RecordPaths paths) {
        return new FileIntentStore(paths);
    }

    @Bean
    public WorkflowCatalog workflowCatalog(AidlcProperties properties) {
        return new WorkflowCatalog(properties.getWorkflows(), properties.recordsRootPath());
    }

    @Bean
    public CommandRunner commandRunner() {
        return new CommandRunner();
    }

    /**
     * git or jj, chosen from {@code aidlc.vcs.backend} and the repository layout.
     */
    @Bean
    public VcsClient vcsClient(CommandRunner runner, AidlcProperties properties) {
        AidlcProperties.Vcs vcs = properties.getVcs();
        return new VcsClientFactory(runner).create(properties.repoRootPath(), vcs.getBackend(),
                vcs.getRemote(), Duration.ofSeconds(vcs.getCommandTimeoutSeconds()));
    }

    @Bean
    public BranchProvisioner branchProvisioner(VcsClient vcsClient, StrategyPolicies policies) {
        return new BranchProvisioner(vcsClient, policies);
    }

    @Bean
    public ManagedBranchLocator managedBranchLocator(VcsClient vcsClient, StrategyPolicies policies) {
        return new ManagedBranchLocator(vcsClient, policies);
    }

    @Bean
    public VcsConfigResolver vcsConfigResolver(IntentStore intentStore, VcsClient vcsClient, AidlcProperties properties) {
        return new VcsConfigResolver(intentStore, vcsClient, properties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Non-web CLI: no actuator, so provide a local registry for the counters
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
