package com.hivemind.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shells out to the {@code git} CLI via {@link ProcessBuilder} rather than depending on JGit.
 * Every failure is logged and reported through the return value.
 */
@Service
public class ProcessGitManager implements GitManager {

    private static final Logger log = LoggerFactory.getLogger(ProcessGitManager.class);

    private final GitProperties properties;
    private volatile Path root;

    public ProcessGitManager(GitProperties properties) {
        this.properties = properties;
    }

    @Override
    public synchronized boolean initRepo(Path workspace) {
        root = null;
        if (!properties.isEnabled()) {
            log.info("Git integration disabled");
            return false;
        }
        try {
            if (Files.isDirectory(workspace.resolve(".git"))) {
                root = workspace;
                log.info("Opened existing git repo: {}", workspace);
                return true;
            }
            GitOutput init = runGit(workspace, "init");
            if (init.exitCode() != 0) {
                log.error("git init failed in {}: {}", workspace, init.output());
                return false;
            }
            root = workspace;
            autoCommit("Initial commit: Hivemind workspace");
            log.info("Initialized new git repo: {}", workspace);
            return true;
        } catch (GitException e) {
            log.warn("Git unavailable, integration disabled: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized Optional<String> autoCommit(String message) {
        Path workDir = root;
        if (workDir == null) {
            return Optional.empty();
        }
        try {
            runGit(workDir, "add", "-A");
            if (runGit(workDir, "status", "--porcelain").output().isBlank()) {
                return Optional.empty();
            }
            GitOutput commit = runGit(workDir,
                    "-c", "user.name=" + properties.getAuthorName(),
                    "-c", "user.email=" + properties.getAuthorEmail(),
                    "commit", "-q", "-m", message);
            if (commit.exitCode() != 0) {
                log.error("Git commit failed: {}", commit.output());
                return Optional.empty();
            }
            String sha = runGit(workDir, "rev-parse", "--short=8", "HEAD").output().strip();
            log.info("Git commit {}: {}", sha, message);
            return Optional.of(sha);
        } catch (GitException e) {
            log.error("Git commit failed: {}", message, e);
            return Optional.empty();
        }
    }

    @Override
    public String diff() {
        Path workDir = root;
        if (workDir == null) {
            return "";
        }
        try {
            return runGit(workDir, "diff").output() + "\n" + runGit(workDir, "diff", "--staged").output();
        } catch (GitException e) {
            log.error("Git diff failed", e);
            return "";
        }
    }

    /**
     * Runs a git command and captures its combined output.
     */
    GitOutput runGit(Path workDir, String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.debug("Git command exited with code {}: {}", exitCode, String.join(" ", command));
            }
            return new GitOutput(exitCode, output);
        } catch (IOException e) {
            throw new GitException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitException("Interrupted running: " + String.join(" ", command), e);
        }
    }

    record GitOutput(int exitCode, String output) {}

    static class GitException extends RuntimeException {
        GitException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
