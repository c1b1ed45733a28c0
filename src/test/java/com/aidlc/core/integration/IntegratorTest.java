package com.aidlc.core.integration;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.dag.DagResolver;
import com.aidlc.core.metrics.IntegrationMetrics;
import com.aidlc.core.model.ChangeStrategy;
import com.aidlc.core.model.CleanupSummary;
import com.aidlc.core.model.Intent;
import com.aidlc.core.model.IntentStatus;
import com.aidlc.core.model.IntegrationResult;
import com.aidlc.core.model.IntegrationStatus;
import com.aidlc.core.model.Unit;
import com.aidlc.core.model.UnitStatus;
import com.aidlc.core.model.ValidationOutcome;
import com.aidlc.core.model.VcsConfig;
import com.aidlc.core.store.FileIntentStore;
import com.aidlc.core.store.FileUnitStore;
import com.aidlc.core.store.IntentStore;
import com.aidlc.core.store.MalformedRecordException;
import com.aidlc.core.store.RecordPaths;
import com.aidlc.core.store.StoreResult;
import com.aidlc.core.store.UnitStore;
import com.aidlc.core.strategy.StrategyPolicies;
import com.aidlc.vcs.PullRequestInfo;
import com.aidlc.vcs.VcsClient;
import com.aidlc.vcs.VcsException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class IntegratorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private IntentStore intentStore;
    private UnitStore unitStore;
    private VcsClient vcs;
    private ValidationHookRunner validation;
    private WorkspaceCleaner cleaner;
    private SimpleMeterRegistry registry;
    private Integrator integrator;

    @BeforeEach
    void setUp() {
        intentStore = mock(IntentStore.class);
        unitStore = mock(UnitStore.class);
        vcs = mock(VcsClient.class);
        validation = mock(ValidationHookRunner.class);
        cleaner = mock(WorkspaceCleaner.class);
        registry = new SimpleMeterRegistry();

        var properties = new AidlcProperties();
        integrator = new Integrator(intentStore, unitStore, new DagResolver(), vcs,
                new StrategyPolicies(properties), validation, cleaner, new PullRequestBodyBuilder(),
                new IntegrationMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC), properties);

        when(validation.run(any())).thenReturn(ValidationOutcome.PASSED);
        when(cleaner.cleanup(anyString(), anyList(), any())).thenReturn(
                new CleanupSummary(List.of("ai-dlc/x/01-a", "ai-dlc/x/02-b"), List.of()));
        when(intentStore.markCompleted(anyString(), any())).thenReturn(StoreResult.ok("Intent x completed"));
    }

    private static Intent intent(String slug, IntentStatus status) {
        return new Intent(slug, "Checkout flow", "Users abandon carts.", null, List.of(), null,
                status, null, null, null);
    }

    private void givenIntent(IntentStatus status, Unit... units) {
        when(intentStore.loadIntent("x")).thenReturn(Optional.of(intent("x", status)));
        when(unitStore.loadUnits("x")).thenReturn(List.of(units));
    }

    private void givenCompletedUnits() {
        givenIntent(IntentStatus.ACTIVE,
                Unit.of("unit-01-a", UnitStatus.COMPLETED),
                Unit.of("unit-02-b", UnitStatus.COMPLETED, "unit-01-a"));
    }

    private static VcsConfig config(ChangeStrategy strategy) {
        return VcsConfig.of(strategy, "main");
    }

    @Nested
    @DisplayName("preconditions")
    class Preconditions {

        @Test
        @DisplayName("missing intent is blocked")
        void missingIntent() {
            when(intentStore.loadIntent("x")).thenReturn(Optional.empty());

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals(List.of("Intent not found: x"), result.errors());
        }

        @Test
        @DisplayName("intent without units is blocked")
        void noUnits() {
            givenIntent(IntentStatus.ACTIVE);

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals("Cannot integrate: intent has no units", result.message());
        }

        @Test
        @DisplayName("unreadable unit record is blocked, not thrown")
        void malformedUnit() {
            when(intentStore.loadIntent("x")).thenReturn(Optional.of(intent("x", IntentStatus.ACTIVE)));
            when(unitStore.loadUnits("x")).thenThrow(new MalformedRecordException("Unit unit-01-a has unrecognised status 'done'"));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals("Cannot integrate: records are unreadable", result.message());
            assertEquals(List.of("Unit unit-01-a has unrecognised status 'done'"), result.errors());
            verifyNoInteractions(vcs, cleaner);
        }

        @Test
        @DisplayName("incomplete DAG is blocked and touches nothing")
        void incompleteDag() {
            givenIntent(IntentStatus.ACTIVE,
                    Unit.of("unit-01-a", UnitStatus.COMPLETED),
                    Unit.of("unit-02-b", UnitStatus.IN_PROGRESS, "unit-01-a"));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.TRUNK));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals(List.of("DAG is not complete - some units still pending or blocked"), result.errors());
            verifyNoInteractions(vcs, validation, cleaner);
            verify(intentStore, never()).markCompleted(anyString(), any());
        }

        @Test
        @DisplayName("unknown strategy is blocked")
        void unknownStrategy() {
            givenCompletedUnits();

            IntegrationResult result = integrator.integrate("x", new VcsConfig("yolo", false, "main", null, null));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals("yolo", result.strategy());
            assertEquals(List.of("Invalid strategy: yolo"), result.errors());
        }

        @Test
        @DisplayName("already completed intent is a no-op")
        void alreadyCompleted() {
            givenIntent(IntentStatus.COMPLETED, Unit.of("unit-01-a", UnitStatus.COMPLETED));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.COMPLETED, result.status());
            assertEquals(CleanupSummary.EMPTY, result.cleanup());
            verifyNoInteractions(cleaner);
            verify(intentStore, never()).markCompleted(anyString(), any());
        }
    }

    @Nested
    @DisplayName("unit and bolt strategies")
    class UnitStrategy {

        @Test
        @DisplayName("all merged completes and marks the intent")
        void completes() {
            givenCompletedUnits();
            when(vcs.branchExists(anyString())).thenReturn(true);
            when(vcs.isAncestor(anyString(), eq("main"))).thenReturn(true);

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.COMPLETED, result.status());
            assertEquals(2, result.cleanup().branchesDeleted().size());
            verify(intentStore).markCompleted("x", NOW);
            verifyNoInteractions(validation);
        }

        @Test
        @DisplayName("deleted branches count as merged")
        void missingBranches() {
            givenCompletedUnits();
            when(vcs.branchExists(anyString())).thenReturn(false);

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.BOLT));

            assertEquals(IntegrationStatus.COMPLETED, result.status());
            verify(vcs, never()).isAncestor(anyString(), anyString());
        }

        @Test
        @DisplayName("unmerged branch is blocked")
        void unmerged() {
            givenCompletedUnits();
            when(vcs.branchExists(anyString())).thenReturn(true);
            when(vcs.isAncestor("ai-dlc/x/01-a", "main")).thenReturn(true);
            when(vcs.isAncestor("ai-dlc/x/02-b", "main")).thenReturn(false);

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals(List.of("Branch not merged: ai-dlc/x/02-b"), result.errors());
        }

        @Test
        @DisplayName("git failing during merge verification is blocked, not thrown")
        void verificationFails() {
            givenCompletedUnits();
            when(vcs.branchExists(anyString())).thenThrow(new VcsException("rev-parse", "Cannot start git"));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals(List.of("Merge verification failed: Cannot start git"), result.errors());
            verifyNoInteractions(cleaner);
            verify(intentStore, never()).markCompleted(anyString(), any());
        }

        @Test
        @DisplayName("store failure while marking is blocked")
        void markFails() {
            givenCompletedUnits();
            when(intentStore.markCompleted(anyString(), any()))
                    .thenReturn(StoreResult.failure(StoreResult.StoreError.IO_FAILURE, "disk full"));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals("Failed to mark intent complete", result.message());
            assertEquals(List.of("disk full"), result.errors());
        }
    }

    @Nested
    @DisplayName("trunk strategy")
    class TrunkStrategy {

        @Test
        @DisplayName("unmerged branch blocks before validation")
        void unmergedBranch() {
            givenCompletedUnits();
            when(vcs.branchExists(anyString())).thenReturn(true);
            when(vcs.isAncestor("ai-dlc/x/01-a", "main")).thenReturn(true);
            when(vcs.isAncestor("ai-dlc/x/02-b", "main")).thenReturn(false);

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.TRUNK));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals("Some unit branches were not merged to main", result.message());
            assertEquals(List.of("Branch not merged: ai-dlc/x/02-b"), result.errors());
            verifyNoInteractions(validation);
            verify(intentStore, never()).markCompleted(anyString(), any());
        }

        @Test
        @DisplayName("ancestry check failure blocks before validation")
        void ancestryCheckFails() {
            givenCompletedUnits();
            when(vcs.branchExists(anyString())).thenReturn(true);
            when(vcs.isAncestor(anyString(), anyString())).thenThrow(new VcsException("merge-base", "Cannot start git"));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.TRUNK));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals("Cannot integrate: merge verification failed", result.message());
            verifyNoInteractions(validation);
        }

        @Test
        @DisplayName("validation failure is blocked")
        void validationFails() {
            givenCompletedUnits();
            when(validation.run(any())).thenReturn(ValidationOutcome.of(List.of("npm test failed")));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.TRUNK));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals(List.of("npm test failed"), result.errors());
            assertEquals(1.0, registry.counter("aidlc.validations.total", "result", "failed").count());
            verifyNoInteractions(cleaner);
        }

        @Test
        @DisplayName("merged and validated completes")
        void completes() {
            givenCompletedUnits();

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.TRUNK));

            assertEquals(IntegrationStatus.COMPLETED, result.status());
            assertEquals("Intent 'x' completed. All 2 units merged and validated.", result.message());
            assertEquals(1.0, registry.counter("aidlc.integrations.total",
                    "strategy", "trunk", "status", "completed").count());
        }
    }

    @Nested
    @DisplayName("intent strategy")
    class IntentStrategy {

        @Test
        @DisplayName("opens a pull request and leaves the intent active")
        void opensPullRequest() {
            givenCompletedUnits();
            when(vcs.createPullRequest(anyString(), anyString(), anyString(), eq("main")))
                    .thenReturn("https://github.com/acme/shop/pull/7");

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.INTENT));

            assertEquals(IntegrationStatus.PR_CREATED, result.status());
            assertEquals("https://github.com/acme/shop/pull/7", result.prUrl());
            verify(vcs).checkout("ai-dlc/x");
            verify(vcs).push("ai-dlc/x");
            verify(vcs).createPullRequest(eq("ai-dlc/x"), eq("[AI-DLC] x"), contains("- [x] unit-02-b"), eq("main"));
            verify(intentStore, never()).markCompleted(anyString(), any());
            verifyNoInteractions(cleaner);
        }

        @Test
        @DisplayName("push failure is blocked")
        void pushFails() {
            givenCompletedUnits();
            doThrow(new VcsException("push", "rejected")).when(vcs).push("ai-dlc/x");

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.INTENT));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals("Failed to push intent branch", result.message());
            verify(vcs, never()).createPullRequest(anyString(), anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("pull request failure carries the gh error")
        void pullRequestFails() {
            givenCompletedUnits();
            when(vcs.createPullRequest(anyString(), anyString(), anyString(), anyString()))
                    .thenThrow(new VcsException("pr-create", "gh pr create failed: not logged in"));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.INTENT));

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals(List.of("PR creation failed: gh pr create failed: not logged in"), result.errors());
        }

        @Test
        @DisplayName("a re-run picks up the pull request it already opened")
        void rerunWithOpenPullRequest() {
            givenCompletedUnits();
            when(vcs.pullRequestFor("ai-dlc/x")).thenReturn(Optional.of(
                    new PullRequestInfo(7, "https://github.com/acme/shop/pull/7", PullRequestInfo.State.OPEN)));
            when(vcs.createPullRequest(anyString(), anyString(), anyString(), anyString()))
                    .thenThrow(new VcsException("pr-create", "a pull request for branch \"ai-dlc/x\" already exists"));

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.INTENT));

            assertEquals(IntegrationStatus.PR_CREATED, result.status());
            assertEquals("https://github.com/acme/shop/pull/7", result.prUrl());
            verify(vcs).push("ai-dlc/x");
            verify(vcs, never()).createPullRequest(anyString(), anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("a closed pull request from an earlier attempt does not stop a new one")
        void closedPullRequestIgnored() {
            givenCompletedUnits();
            when(vcs.pullRequestFor("ai-dlc/x")).thenReturn(Optional.of(
                    new PullRequestInfo(5, "https://github.com/acme/shop/pull/5", PullRequestInfo.State.CLOSED)));
            when(vcs.createPullRequest(anyString(), anyString(), anyString(), anyString()))
                    .thenReturn("https://github.com/acme/shop/pull/8");

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.INTENT));

            assertEquals("https://github.com/acme/shop/pull/8", result.prUrl());
        }

        @Test
        @DisplayName("a failed lookup still attempts creation")
        void lookupFails() {
            givenCompletedUnits();
            when(vcs.pullRequestFor("ai-dlc/x")).thenThrow(new VcsException("pr-list", "gh pr list failed"));
            when(vcs.createPullRequest(anyString(), anyString(), anyString(), anyString()))
                    .thenReturn("https://github.com/acme/shop/pull/8");

            IntegrationResult result = integrator.integrate("x", config(ChangeStrategy.INTENT));

            assertEquals(IntegrationStatus.PR_CREATED, result.status());
        }
    }

    @Nested
    @DisplayName("completeAfterApproval")
    class CompleteAfterApproval {

        @Test
        @DisplayName("other strategies are skipped")
        void skipsOtherStrategies() {
            givenCompletedUnits();

            IntegrationResult result = integrator.completeAfterApproval("x", config(ChangeStrategy.UNIT), 7);

            assertEquals(IntegrationStatus.SKIPPED, result.status());
            verify(vcs, never()).mergePullRequest(anyInt());
        }

        @Test
        @DisplayName("merges, validates and completes")
        void completes() {
            givenCompletedUnits();

            IntegrationResult result = integrator.completeAfterApproval("x", config(ChangeStrategy.INTENT), 7);

            assertEquals(IntegrationStatus.COMPLETED, result.status());
            assertEquals("Intent 'x' completed and merged.", result.message());
            verify(vcs).mergePullRequest(7);
            verify(intentStore).markCompleted("x", NOW);
        }

        @Test
        @DisplayName("without a PR number nothing is merged")
        void noPullRequestNumber() {
            givenCompletedUnits();

            integrator.completeAfterApproval("x", config(ChangeStrategy.INTENT), null);

            verify(vcs, never()).mergePullRequest(anyInt());
            verify(validation).run(any());
        }

        @Test
        @DisplayName("merge failure is blocked")
        void mergeFails() {
            givenCompletedUnits();
            doThrow(new VcsException("pr-merge", "conflict")).when(vcs).mergePullRequest(7);

            IntegrationResult result = integrator.completeAfterApproval("x", config(ChangeStrategy.INTENT), 7);

            assertEquals(IntegrationStatus.BLOCKED, result.status());
            assertEquals("Failed to merge PR", result.message());
            verifyNoInteractions(validation);
        }

        @Test
        @DisplayName("validation failure after merge is blocked")
        void validationFails() {
            givenCompletedUnits();
            when(validation.run(any())).thenReturn(ValidationOutcome.of(List.of("cargo test failed")));

            IntegrationResult result = integrator.completeAfterApproval("x", config(ChangeStrategy.INTENT), null);

            assertEquals("Post-merge validation failed", result.message());
            verify(intentStore, never()).markCompleted(anyString(), any());
        }
    }

    @Nested
    @DisplayName("with records on disk")
    class OnDisk {

        @TempDir
        Path recordsRoot;

        @Test
        @DisplayName("integrating twice completes once and the second run writes nothing")
        void integrateTwice() throws IOException {
            Path dir = Files.createDirectories(recordsRoot.resolve("x"));
            Files.writeString(dir.resolve("intent.md"), "---\nstatus: active\n---\n# Checkout flow\n");
            Files.writeString(dir.resolve("unit-01-a.md"), "---\nstatus: completed\n---\n# unit-01-a\n");
            Files.writeString(dir.resolve("unit-02-b.md"),
                    "---\nstatus: completed\ndepends_on: [unit-01-a]\n---\n# unit-02-b\n");

            var paths = new RecordPaths(recordsRoot);
            IntentStore fileIntents = spy(new FileIntentStore(paths));
            var properties = new AidlcProperties();
            var onDisk = new Integrator(fileIntents, new FileUnitStore(paths), new DagResolver(), vcs,
                    new StrategyPolicies(properties), validation, cleaner, new PullRequestBodyBuilder(),
                    new IntegrationMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC), properties);

            IntegrationResult first = onDisk.integrate("x", config(ChangeStrategy.UNIT));
            String afterFirst = Files.readString(dir.resolve("intent.md"));
            IntegrationResult second = onDisk.integrate("x", config(ChangeStrategy.UNIT));

            assertEquals(IntegrationStatus.COMPLETED, first.status());
            assertEquals(IntegrationStatus.COMPLETED, second.status());
            assertEquals("Intent 'x' is already completed.", second.message());
            assertEquals(CleanupSummary.EMPTY, second.cleanup());
            assertTrue(fileIntents.loadIntent("x").orElseThrow().isCompleted());
            assertEquals(afterFirst, Files.readString(dir.resolve("intent.md")));
            verify(fileIntents, times(1)).markCompleted(eq("x"), any());
            verify(cleaner, times(1)).cleanup(anyString(), anyList(), any());
            verify(vcs, never()).deleteBranch(anyString());
        }
    }

    @Test
    @DisplayName("readiness reports unknown strategies")
    void readiness() {
        assertTrue(integrator.readiness("trunk").shouldRun());
        assertFalse(integrator.readiness("yolo").shouldRun());
    }
}
