package com.aidlc.core.strategy;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.model.ChangeStrategy;
import com.aidlc.vcs.VcsClient;
import com.aidlc.vcs.VcsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BranchProvisionerTest {

    private VcsClient vcs;
    private BranchProvisioner provisioner;

    @BeforeEach
    void setUp() {
        vcs = mock(VcsClient.class);
        provisioner = new BranchProvisioner(vcs, new StrategyPolicies(new AidlcProperties()));
    }

    @Test
    @DisplayName("creates a missing branch from the base")
    void createsMissingBranch() {
        when(vcs.branchExists("ai-dlc/checkout/02-api")).thenReturn(false);

        String branch = provisioner.ensureBranch(ChangeStrategy.UNIT, BranchContext.forUnit("checkout", "02-api"), "main");

        assertEquals("ai-dlc/checkout/02-api", branch);
        verify(vcs).createBranch("ai-dlc/checkout/02-api", "main");
    }

    @Test
    @DisplayName("reuses an existing branch")
    void reusesExisting() {
        when(vcs.branchExists("ai-dlc/checkout")).thenReturn(true);

        provisioner.ensureBranch(ChangeStrategy.INTENT, BranchContext.forIntent("checkout"), "main");

        verify(vcs, never()).createBranch(anyString(), anyString());
    }

    @Test
    @DisplayName("a failed create succeeds when the branch now exists")
    void concurrentCreate() {
        when(vcs.branchExists("ai-dlc/checkout")).thenReturn(false, true);
        doThrow(new VcsException("create-branch", "already exists")).when(vcs).createBranch("ai-dlc/checkout", "main");

        assertEquals("ai-dlc/checkout", provisioner.ensureBranch("ai-dlc/checkout", "main"));
    }

    @Test
    @DisplayName("a failed create propagates when the branch is still missing")
    void realFailure() {
        when(vcs.branchExists("ai-dlc/checkout")).thenReturn(false);
        doThrow(new VcsException("create-branch", "bad base")).when(vcs).createBranch("ai-dlc/checkout", "nope");

        assertThrows(VcsException.class, () -> provisioner.ensureBranch("ai-dlc/checkout", "nope"));
    }
}
