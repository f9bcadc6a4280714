package com.hivemind.core.terminal;

import java.time.Duration;

/**
 * Outcome of one shell command.
 *
 * @param returnCode process exit code, -1 when the process could not be started or was killed
 */
public record CommandResult(
    String command,
    String stdout,
    String stderr,
    int returnCode,
    Duration duration,
    boolean timedOut
) {

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public boolean success() {
        return returnCode == 0 && !timedOut;
    }
}
