package com.aidlc.core.integration;

import com.aidlc.core.model.Intent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Markdown body for an intent's integration pull request.
 */
@Component
public class PullRequestBodyBuilder {

    private static final int SUMMARY_LINES = 5;

    public String build(Intent intent, List<String> completedUnits) {
        var sb = new StringBuilder("## Summary\n\n");
        String summary = summary(intent);
        if (!summary.isEmpty()) {
            sb.append(summary).append("\n\n");
        }
        sb.append("## Units Completed\n\n");
        for (String unit : completedUnits) {
            sb.append("- [x] ").append(unit).append('\n');
        }
        sb.append("\n---\n\nGenerated by AI-DLC Integrator\n");
        return sb.toString();
    }

    private static String summary(Intent intent) {
        var lines = new ArrayList<String>();
        if (intent.title() != null) {
            lines.add(intent.title());
        }
        if (intent.problem() != null) {
            if (!lines.isEmpty()) lines.add("");
            lines.addAll(intent.problem().lines().toList());
        }
        return String.join("\n", lines.subList(0, Math.min(SUMMARY_LINES, lines.size()))).trim();
    }
}
