package com.aidlc.core.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BranchNamesTest {

    @Test
    @DisplayName("parses intent, unit and bolt segments")
    void parsesSegments() {
        assertEquals(Optional.of(new BranchContext("checkout", null, null)), BranchNames.parse("ai-dlc", "ai-dlc/checkout"));
        assertEquals(Optional.of(new BranchContext("checkout", "02-api", null)),
                BranchNames.parse("ai-dlc", "ai-dlc/checkout/02-api"));
        assertEquals(Optional.of(new BranchContext("checkout", "02-api", "3")),
                BranchNames.parse("ai-dlc", "ai-dlc/checkout/02-api/3"));
    }

    @Test
    @DisplayName("other branches are not managed")
    void rejectsOthers() {
        assertTrue(BranchNames.parse("ai-dlc", "main").isEmpty());
        assertTrue(BranchNames.parse("ai-dlc", "feature/checkout").isEmpty());
        assertTrue(BranchNames.parse("ai-dlc", "ai-dlc/a/b/c/d").isEmpty());
        assertTrue(BranchNames.parse("ai-dlc", "ai-dlc/").isEmpty());
        assertTrue(BranchNames.parse("ai-dlc", null).isEmpty());
    }

    @Test
    @DisplayName("prefix is matched literally")
    void literalPrefix() {
        assertTrue(BranchNames.parse("ai.dlc", "aiXdlc/checkout").isEmpty());
        assertTrue(BranchNames.parse("ai.dlc", "ai.dlc/checkout").isPresent());
    }
}
