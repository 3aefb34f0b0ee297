package com.governance.engine.sync;

import com.governance.engine.events.LogSanitizer;
import com.governance.engine.model.RepositoryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Compares the current branch with its upstream using read-only git plumbing commands.
 * Not a repository, no upstream, git missing or a command timing out all yield
 * {@link Optional#empty()}.
 */
public class GitRepositoryStatusProvider implements RepositoryStatusProvider {

    private static final Logger log = LoggerFactory.getLogger(GitRepositoryStatusProvider.class);

    private final String gitExecutable;
    private final Duration timeout;

    public GitRepositoryStatusProvider(Duration timeout) {
        this("git", timeout);
    }

    GitRepositoryStatusProvider(String gitExecutable, Duration timeout) {
        this.gitExecutable = gitExecutable;
        this.timeout = timeout;
    }

    @Override
    public Optional<RepositoryStatus> getRepositoryStatus(Path projectRoot) {
        try {
            if (run(projectRoot, "rev-parse", "--show-toplevel") == null) {
                return Optional.empty();
            }
            String branch = run(projectRoot, "rev-parse", "--abbrev-ref", "HEAD");
            if (branch == null || branch.isEmpty()) {
                return Optional.empty();
            }
            String upstream = run(projectRoot, "rev-parse", "--abbrev-ref", "--symbolic-full-name", "@{u}");
            if (upstream == null || upstream.isEmpty()) {
                return Optional.empty();
            }
            String counts = run(projectRoot, "rev-list", "--left-right", "--count", branch + "..." + upstream);
            if (counts == null) {
                return Optional.empty();
            }
            String[] parts = counts.trim().split("\\s+");
            if (parts.length != 2) {
                return Optional.empty();
            }
            int ahead = Integer.parseInt(parts[0]);
            int behind = Integer.parseInt(parts[1]);
            return Optional.of(new RepositoryStatus(behind > 0, upstream, behind, ahead));
        } catch (IOException | NumberFormatException e) {
            log.debug("Repository check failed: {}", LogSanitizer.sanitize(e));
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Repository check interrupted");
            return Optional.empty();
        }
    }

    /**
     * @return trimmed stdout on exit code 0, null on a non-zero exit or timeout
     */
    private String run(Path cwd, String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command)
                .directory(cwd.toFile())
                .redirectErrorStream(false)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        process.getOutputStream().close();
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            log.debug("git {} timed out after {}", args[0], timeout);
            return null;
        }
        String stdout;
        try (InputStream in = process.getInputStream()) {
            stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        }
        return process.exitValue() == 0 ? stdout : null;
    }
}
