package com.coderocket.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads diffs and commits from a git repository by running the git executable.
 */
public class GitSource {

    private static final Logger log = LoggerFactory.getLogger(GitSource.class);

    static final int TIMEOUT_SECONDS = 30;
    static final int MAX_OUTPUT_CHARS = 10 * 1024 * 1024;

    private final String gitExecutable;

    public GitSource() {
        this("git");
    }

    public GitSource(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    public boolean isRepository(Path repo) {
        try {
            return !run(repo, List.of("rev-parse", "--git-dir")).isBlank();
        } catch (GitException e) {
            return false;
        }
    }

    /**
     * Staged and/or unstaged changes. A failing diff command is logged and contributes
     * nothing, so one broken half does not hide the other.
     */
    public String changes(Path repo, boolean includeStaged, boolean includeUnstaged) {
        List<List<String>> commands = new ArrayList<>();
        if (includeStaged) commands.add(List.of("diff", "--cached"));
        if (includeUnstaged) commands.add(List.of("diff"));

        StringBuilder all = new StringBuilder();
        for (List<String> command : commands) {
            try {
                all.append(run(repo, command)).append('\n');
            } catch (GitException e) {
                log.warn("git {} failed: {}", String.join(" ", command), e.getMessage());
            }
        }
        return all.toString();
    }

    /**
     * Commit metadata, stats and patch for {@code commitHash}, or HEAD when null.
     */
    public String show(Path repo, String commitHash) throws GitException {
        String ref = commitHash == null || commitHash.isBlank() ? "HEAD" : commitHash;
        return run(repo, List.of("show", ref, "--pretty=fuller", "--stat", "--patch"));
    }

    /**
     * Run git with stdout and stderr redirected to temp files, so neither pipe can fill up
     * and the timeout bounds the whole run.
     */
    String run(Path repo, List<String> args) throws GitException {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(args);
        String display = "git " + String.join(" ", args);

        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("coderocket-git-", ".out");
            stderr = Files.createTempFile("coderocket-git-", ".err");
            Process process;
            try {
                process = new ProcessBuilder(command)
                        .directory(repo.toFile())
                        .redirectOutput(stdout.toFile())
                        .redirectError(stderr.toFile())
                        .start();
            } catch (IOException e) {
                throw new GitException("Could not run %s: %s".formatted(display, e.getMessage()), e);
            }

            try {
                boolean finished = process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    throw new GitException("%s timed out after %d seconds".formatted(display, TIMEOUT_SECONDS));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new GitException(display + " was interrupted", e);
            }

            if (process.exitValue() != 0) {
                throw new GitException("%s failed (exit code %d): %s"
                        .formatted(display, process.exitValue(), readCapped(stderr).trim()));
            }
            return readCapped(stdout);
        } catch (GitException e) {
            throw e;
        } catch (IOException e) {
            throw new GitException("Could not read output of %s: %s".formatted(display, e.getMessage()), e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }

    private static String readCapped(Path file) throws IOException {
        StringBuilder output = new StringBuilder();
        boolean truncated = false;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (output.length() + line.length() < MAX_OUTPUT_CHARS) {
                    output.append(line).append('\n');
                } else {
                    truncated = true;
                }
            }
        }
        if (truncated) {
            output.append("\n[Truncated at %d characters]".formatted(MAX_OUTPUT_CHARS));
        }
        return output.toString();
    }
}
