package com.hivemind.core.terminal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands through {@code sh -c} with a timeout and a cap on concurrent processes.
 */
@Service
public class ProcessTerminal implements Terminal {

    private static final Logger log = LoggerFactory.getLogger(ProcessTerminal.class);

    private final TerminalProperties properties;
    private final Clock clock;
    private final Semaphore permits;

    public ProcessTerminal(TerminalProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.permits = new Semaphore(Math.max(1, properties.getMaxConcurrent()));
    }

    @Override
    public CommandResult execute(String command, Path cwd) throws InterruptedException {
        permits.acquire();
        try {
            return run(command, cwd);
        } finally {
            permits.release();
        }
    }

    private CommandResult run(String command, Path cwd) throws InterruptedException {
        Instant start = clock.instant();
        log.info("Executing: {} (cwd={})", command, cwd);

        Process process;
        try {
            process = new ProcessBuilder(properties.getShell(), "-c", command)
                    .directory(cwd.toFile())
                    .start();
            process.getOutputStream().close();
        } catch (IOException e) {
            log.error("Failed to start command: {}", command, e);
            return new CommandResult(command, "", e.getMessage(), -1, elapsed(start), false);
        }

        // drain both streams concurrently so a full pipe never blocks the child
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

        boolean finished;
        try {
            finished = process.waitFor(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!finished) {
            log.warn("Command timed out after {}: {}", properties.getTimeout(), command);
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
        }

        String out = collect(stdout, command);
        String err = collect(stderr, command);
        int exitCode = finished ? process.exitValue() : -1;
        Duration duration = elapsed(start);
        log.info("Command finished with code {} in {} ms: {}", exitCode, duration.toMillis(), command);
        return new CommandResult(command, tail(out), tail(err), exitCode, duration, !finished);
    }

    private Duration elapsed(Instant start) {
        return Duration.between(start, clock.instant());
    }

    private String tail(String output) {
        int max = properties.getMaxOutputChars();
        return output.length() <= max ? output : output.substring(output.length() - max);
    }

    private static String collect(CompletableFuture<String> future, String command) throws InterruptedException {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            log.warn("Failed to read output of '{}': {}", command, e.getCause().getMessage());
            return "";
        } catch (TimeoutException e) {
            log.warn("Output of '{}' still open after the process ended", command);
            future.cancel(true);
            return "";
        }
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
