package com.aidlc.vcs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JjVcsClientTest {

    private TestableJjVcsClient client;

    @BeforeEach
    void setUp() {
        client = new TestableJjVcsClient();
    }

    @Test
    void branchExistsMatchesExactBookmark() {
        client.respond("bookmark", 0, "ai-dlc/x/01-a\n");
        assertTrue(client.branchExists("ai-dlc/x/01-a"));
        assertEquals("list", client.lastCommand().get(1));

        client.respond("bookmark", 0, "");
        assertFalse(client.branchExists("ai-dlc/x/01-a"));
    }

    @Test
    void createBranchCreatesBookmarkAtBase() {
        client.createBranch("ai-dlc/x", "main");
        assertEquals(List.of("bookmark", "create", "ai-dlc/x", "-r", "main"), client.lastCommand());
    }

    @Test
    void isAncestorQueriesRevset() {
        client.respond("log", 0, "abc123\n");
        assertTrue(client.isAncestor("ai-dlc/x/01-a", "main"));
        assertEquals("\"ai-dlc/x/01-a\" & ::\"main\"", client.lastCommand().get(2));

        client.respond("log", 0, "");
        assertFalse(client.isAncestor("ai-dlc/x/01-a", "main"));
    }

    @Test
    void pushUsesGitBridge() {
        client.push("ai-dlc/x");
        assertEquals(List.of("git", "push", "--bookmark", "ai-dlc/x", "--remote", "origin"), client.lastCommand());
    }

    @Test
    void checkoutStartsNewChange() {
        client.checkout("ai-dlc/x");
        assertEquals(List.of("new", "ai-dlc/x"), client.lastCommand());
    }

    @Test
    void mergeCreatesMergeChangeAndMovesBookmark() {
        client.respond("log", 0, "main\n");

        client.merge("ai-dlc/x/01-a", true);

        int n = client.executedCommands.size();
        assertEquals(List.of("new", "main", "ai-dlc/x/01-a", "-m", "Merge ai-dlc/x/01-a"), client.executedCommands.get(n - 2));
        assertEquals(List.of("bookmark", "set", "main", "-r", "@"), client.lastCommand());
    }

    @Test
    void mergeWithoutBookmarkThrows() {
        client.respond("log", 0, "\n");

        var e = assertThrows(VcsException.class, () -> client.merge("ai-dlc/x/01-a", false));
        assertEquals("merge", e.operation());
    }

    @Test
    void deleteFailureThrows() {
        client.respond("bookmark", 1, "No such bookmark");
        assertThrows(VcsException.class, () -> client.deleteBranch("ai-dlc/x"));
    }

    @Test
    void defaultBranchFromTrunkRevset() {
        client.respond("log", 0, "main@origin main\n");
        assertEquals("main", client.detectDefaultBranch());
    }

    @Test
    void defaultBranchFallsBackToDefault() {
        client.respond("log", 1, "");
        client.respond("bookmark", 0, "");
        assertEquals("main", client.detectDefaultBranch());
    }

    @Test
    void firstBookmarkStripsMarkers() {
        assertEquals(Optional.of("feature"), JjVcsClient.firstBookmark("\nfeature* other\n"));
        assertEquals(Optional.of("main"), JjVcsClient.firstBookmark("main@origin\n"));
        assertEquals(Optional.empty(), JjVcsClient.firstBookmark("\n\n"));
    }

    @Test
    void backendIsJj() {
        assertEquals(VcsBackend.JJ, client.backend());
    }

    static class TestableJjVcsClient extends JjVcsClient {

        final List<List<String>> executedCommands = new ArrayList<>();
        private final Map<String, CommandResult> responses = new HashMap<>();

        TestableJjVcsClient() {
            super(Path.of("/tmp/repo"), "origin", new CommandRunner(Map.of()), Duration.ofSeconds(5));
        }

        void respond(String subcommand, int exitCode, String output) {
            responses.put(subcommand, new CommandResult(exitCode, output, false));
        }

        List<String> lastCommand() {
            return executedCommands.get(executedCommands.size() - 1);
        }

        @Override
        CommandResult runJj(String... args) {
            executedCommands.add(List.of(args));
            return responses.getOrDefault(args[0], new CommandResult(0, "", false));
        }
    }
}
