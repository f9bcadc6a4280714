package com.hivemind.core.terminal;

import java.nio.file.Path;

/**
 * Runs shell commands on behalf of agents.
 */
public interface Terminal {

    /**
     * Runs {@code command} in {@code cwd}. Failures to start or a timeout are reported in
     * the result rather than thrown.
     */
    CommandResult execute(String command, Path cwd) throws InterruptedException;
}
