package com.aidlc.core.integration;

import com.aidlc.core.model.ValidationOutcome;

import java.nio.file.Path;

/**
 * Runs the project's own checks (tests, lint, type checks) against a working copy. A project
 * with nothing runnable passes.
 */
public interface ValidationHookRunner {

    ValidationOutcome run(Path repoRoot);
}
