package com.aidlc.core.strategy;

import com.aidlc.core.model.ChangeStrategy;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Suggests a change strategy from what the repository already automates. Trunk-based flow with
 * auto-merge is only suggested when both CI and a test setup are present.
 */
@Service
public class StrategyAdvisor {

    static final List<String> CI_MARKERS = List.of(".github/workflows", ".gitlab-ci.yml", "Jenkinsfile");
    static final List<String> TEST_MARKERS = List.of(
            "jest.config.js", "vitest.config.ts", "pytest.ini", "Cargo.toml", "pom.xml");

    public StrategyRecommendation recommend(Path repoRoot) {
        boolean hasCi = anyExists(repoRoot, CI_MARKERS);
        boolean hasTests = anyExists(repoRoot, TEST_MARKERS);
        if (hasCi && hasTests) {
            return new StrategyRecommendation(ChangeStrategy.TRUNK,
                    "CI and tests detected - trunk strategy with auto-merge recommended for fast iteration");
        }
        return new StrategyRecommendation(ChangeStrategy.UNIT,
                "Unit strategy provides good balance of review granularity and merge frequency");
    }

    private static boolean anyExists(Path root, List<String> markers) {
        return markers.stream().anyMatch(marker -> Files.exists(root.resolve(marker)));
    }
}
