package com.aidlc.core.phase;

import com.aidlc.core.model.DagSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PhaseRecommenderTest {

    private static final List<String> FOUR_HATS = List.of("elaborator", "planner", "builder", "reviewer");

    private final PhaseRecommender recommender = new PhaseRecommender();

    @Test
    @DisplayName("no units yet goes to the second hat")
    void noUnits() {
        assertEquals("planner", recommender.recommend(0, new DagSummary(0, 0, 0, 0, 0), FOUR_HATS));
    }

    @Test
    @DisplayName("nothing pending or in progress goes to the last hat")
    void allDone() {
        assertEquals("reviewer", recommender.recommend(3, new DagSummary(0, 0, 3, 0, 0), FOUR_HATS));
    }

    @Test
    @DisplayName("two ready and two blocked units go to the third hat")
    void readyWork() {
        assertEquals("builder", recommender.recommend(4, new DagSummary(4, 0, 0, 2, 2), FOUR_HATS));
    }

    @Test
    @DisplayName("work in progress goes to the third hat")
    void inProgress() {
        assertEquals("builder", recommender.recommend(2, new DagSummary(1, 1, 0, 1, 0), FOUR_HATS));
    }

    @Test
    @DisplayName("all pending units blocked goes back to the second hat")
    void everythingBlocked() {
        assertEquals("planner", recommender.recommend(2, new DagSummary(2, 0, 0, 2, 0), FOUR_HATS));
    }

    @Test
    @DisplayName("short workflows clamp to the hats they have")
    void shortWorkflows() {
        var two = List.of("planner", "builder");
        assertEquals("builder", recommender.recommend(2, new DagSummary(2, 0, 0, 0, 2), two));
        assertEquals("builder", recommender.recommend(0, new DagSummary(0, 0, 0, 0, 0), two));

        var one = List.of("solo");
        assertEquals("solo", recommender.recommend(0, new DagSummary(0, 0, 0, 0, 0), one));
        assertEquals("solo", recommender.recommend(2, new DagSummary(2, 0, 0, 2, 0), one));
    }

    @Test
    @DisplayName("a workflow without hats is rejected")
    void emptyWorkflow() {
        assertThrows(IllegalArgumentException.class,
                () -> recommender.recommend(1, new DagSummary(1, 0, 0, 0, 1), List.of()));
    }
}
