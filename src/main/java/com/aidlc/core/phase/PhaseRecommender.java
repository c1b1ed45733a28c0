package com.aidlc.core.phase;

import com.aidlc.core.model.DagSummary;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the workflow phase ("hat") an intent should resume in, from its unit counts alone.
 * <p>
 * Lookup, in order of precedence:
 * <ol>
 *   <li>no units yet: second hat (decomposition), or the first when there is only one</li>
 *   <li>nothing pending or in progress: last hat (review)</li>
 *   <li>work in progress or ready: third hat (build), or the last when there are fewer than three</li>
 *   <li>everything blocked: second hat, or the first when there is only one</li>
 * </ol>
 */
@Service
public class PhaseRecommender {

    public String recommend(int unitCount, DagSummary summary, List<String> hats) {
        if (hats == null || hats.isEmpty()) {
            throw new IllegalArgumentException("Workflow must define at least one hat");
        }
        int n = hats.size();

        if (unitCount == 0) {
            return n >= 2 ? hats.get(1) : hats.get(0);
        }
        if (summary.pending() == 0 && summary.inProgress() == 0) {
            return hats.get(n - 1);
        }
        if (summary.inProgress() > 0 || summary.ready() > 0) {
            return n >= 3 ? hats.get(2) : hats.get(n - 1);
        }
        return n >= 2 ? hats.get(1) : hats.get(0);
    }
}
