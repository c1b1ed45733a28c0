package com.aidlc.core.strategy;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.vcs.VcsClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ManagedBranchLocatorTest {

    private VcsClient vcs;
    private ManagedBranchLocator locator;

    @BeforeEach
    void setUp() {
        vcs = mock(VcsClient.class);
        locator = new ManagedBranchLocator(vcs, new StrategyPolicies(new AidlcProperties()));
    }

    @Test
    void unitBranchYieldsIntentAndUnit() {
        when(vcs.currentBranch()).thenReturn(Optional.of("ai-dlc/checkout/02-ui"));

        assertEquals(Optional.of(new BranchContext("checkout", "02-ui", null)), locator.current());
        assertEquals(Optional.of("checkout"), locator.currentIntent());
    }

    @Test
    void intentBranchHasNoUnit() {
        when(vcs.currentBranch()).thenReturn(Optional.of("ai-dlc/checkout"));

        assertEquals(Optional.of(BranchContext.forIntent("checkout")), locator.current());
    }

    @Test
    void unmanagedBranchIsEmpty() {
        when(vcs.currentBranch()).thenReturn(Optional.of("feature/login"));

        assertTrue(locator.currentIntent().isEmpty());
    }

    @Test
    void detachedHeadIsEmpty() {
        when(vcs.currentBranch()).thenReturn(Optional.empty());

        assertTrue(locator.current().isEmpty());
    }
}
