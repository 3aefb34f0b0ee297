package com.governance.engine.sync;

import com.governance.engine.model.RepositoryStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GitRepositoryStatusProviderTest {

    @TempDir
    Path root;

    private final GitRepositoryStatusProvider provider = new GitRepositoryStatusProvider(Duration.ofSeconds(10));

    @Test
    void missingExecutableYieldsEmpty() {
        GitRepositoryStatusProvider missing =
                new GitRepositoryStatusProvider("governance-no-such-git-binary", Duration.ofSeconds(2));

        assertThat(missing.getRepositoryStatus(root)).isEmpty();
    }

    @Test
    void noneProviderNeverReports() {
        assertThat(RepositoryStatusProvider.none().getRepositoryStatus(root)).isEmpty();
    }

    @Test
    void countsCommitsOnBothSidesOfUpstream() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        Path remote = root.resolve("remote.git");
        Path work = root.resolve("work");
        Path other = root.resolve("other");

        git(root, "init", "--bare", remote.toString());
        git(root, "init", work.toString());
        git(work, "symbolic-ref", "HEAD", "refs/heads/main");
        git(work, "commit", "--allow-empty", "-m", "initial");
        git(work, "remote", "add", "origin", remote.toString());
        git(work, "push", "-u", "origin", "main");

        git(root, "clone", "-b", "main", remote.toString(), other.toString());
        git(other, "commit", "--allow-empty", "-m", "remote one");
        git(other, "commit", "--allow-empty", "-m", "remote two");
        git(other, "push", "origin", "main");

        git(work, "commit", "--allow-empty", "-m", "local one");
        git(work, "fetch", "origin");

        assertThat(provider.getRepositoryStatus(work))
                .contains(new RepositoryStatus(true, "origin/main", 2, 1));
    }

    @Test
    void repositoryWithoutUpstreamYieldsEmpty() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        Path work = root.resolve("work");
        git(root, "init", work.toString());
        git(work, "commit", "--allow-empty", "-m", "initial");

        assertThat(provider.getRepositoryStatus(work)).isEmpty();
    }

    @Test
    void plainDirectoryYieldsEmpty() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        Path plain = Files.createDirectory(root.resolve("plain"));

        assertThat(provider.getRepositoryStatus(plain)).isEmpty();
    }

    private static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void git(Path cwd, String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>(List.of("git",
                "-c", "user.name=Governance Test",
                "-c", "user.email=governance@example.com",
                "-c", "commit.gpgsign=false",
                "-c", "init.defaultBranch=main"));
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command)
                .directory(cwd.toFile())
                .redirectErrorStream(true)
                .start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertThat(process.waitFor(30, TimeUnit.SECONDS)).as("git %s timed out", args[0]).isTrue();
        assertThat(process.exitValue()).as("git %s failed: %s", String.join(" ", args), output).isZero();
    }
}
