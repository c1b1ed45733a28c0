package com.aidlc.dispatch.cli;

import com.aidlc.core.model.CleanupSummary;
import com.aidlc.core.model.IntegrationResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the aidlc CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AI-DLC]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void heading(String title) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
    }

    public static void plain(String text) {
        System.out.println(text);
    }

    public static void result(IntegrationResult result) {
        String status = switch (result.status()) {
            case COMPLETED -> "@|fg(green),bold [COMPLETED]|@";
            case PR_CREATED -> "@|fg(cyan),bold [PR CREATED]|@";
            case SKIPPED -> "@|fg(yellow),bold [SKIPPED]|@";
            case BLOCKED -> "@|fg(red),bold [BLOCKED]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                status + " " + result.message() + " @|faint (" + result.strategy() + ")|@"));
        if (result.prUrl() != null) {
            System.out.println("  PR: " + result.prUrl());
        }
        for (String error : result.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + error));
        }
        CleanupSummary cleanup = result.cleanup();
        if (cleanup != null && (!cleanup.branchesDeleted().isEmpty() || !cleanup.worktreesRemoved().isEmpty())) {
            System.out.println("  Cleanup: " + cleanup.branchesDeleted().size() + " branch(es) deleted, "
                    + cleanup.worktreesRemoved().size() + " worktree(s) removed");
        }
    }
}
