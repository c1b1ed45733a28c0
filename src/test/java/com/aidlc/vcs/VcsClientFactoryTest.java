package com.aidlc.vcs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VcsClientFactoryTest {

    @TempDir
    Path repo;

    @Test
    void autoSelectsGitWithoutJjDirectory() {
        assertEquals(VcsBackend.GIT, VcsClientFactory.select(repo, "auto"));
        assertEquals(VcsBackend.GIT, VcsClientFactory.select(repo, null));
    }

    @Test
    void autoSelectsJjWhenColocated() throws IOException {
        Files.createDirectories(repo.resolve(".jj"));
        assertEquals(VcsBackend.JJ, VcsClientFactory.select(repo, "auto"));
    }

    @Test
    void explicitBackendWins() throws IOException {
        Files.createDirectories(repo.resolve(".jj"));
        assertEquals(VcsBackend.GIT, VcsClientFactory.select(repo, "GIT"));
        assertEquals(VcsBackend.JJ, VcsClientFactory.select(repo, " jj "));
    }

    @Test
    void unknownBackendRejected() {
        var e = assertThrows(IllegalArgumentException.class, () -> VcsClientFactory.select(repo, "hg"));
        assertTrue(e.getMessage().contains("auto, git, or jj"));
    }

    @Test
    void createBuildsMatchingClient() {
        var factory = new VcsClientFactory(new CommandRunner(Map.of()));

        assertInstanceOf(GitVcsClient.class, factory.create(repo, "git", "origin", Duration.ofSeconds(5)));
        assertInstanceOf(JjVcsClient.class, factory.create(repo, "jj", "origin", Duration.ofSeconds(5)));
    }
}
