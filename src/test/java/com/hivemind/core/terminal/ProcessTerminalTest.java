package com.hivemind.core.terminal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessTerminalTest {

    @TempDir
    Path workspace;

    private TerminalProperties properties;
    private ProcessTerminal terminal;

    @BeforeEach
    void setUp() {
        properties = new TerminalProperties();
        terminal = new ProcessTerminal(properties, Clock.systemUTC());
    }

    @Test
    @DisplayName("captures stdout, stderr and exit code")
    void capturesOutput() throws Exception {
        CommandResult result = terminal.execute("echo hello; echo oops 1>&2; exit 3", workspace);

        assertEquals("hello\n", result.stdout());
        assertEquals("oops\n", result.stderr());
        assertEquals(3, result.returnCode());
        assertFalse(result.timedOut());
        assertFalse(result.success());
    }

    @Test
    @DisplayName("runs in the given working directory")
    void workingDirectory() throws Exception {
        Files.writeString(workspace.resolve("marker.txt"), "here");

        CommandResult result = terminal.execute("cat marker.txt", workspace);

        assertTrue(result.success());
        assertEquals("here", result.stdout());
    }

    @Test
    @DisplayName("kills commands that exceed the timeout")
    void timeout() throws Exception {
        properties.setTimeout(Duration.ofMillis(200));

        CommandResult result = terminal.execute("sleep 5", workspace);

        assertTrue(result.timedOut());
        assertEquals(-1, result.returnCode());
        assertFalse(result.success());
    }

    @Test
    @DisplayName("keeps only the tail of long output")
    void truncatesOutput() throws Exception {
        properties.setMaxOutputChars(4);

        CommandResult result = terminal.execute("printf 'abcdefgh'", workspace);

        assertEquals("efgh", result.stdout());
    }

    @Test
    @DisplayName("a missing working directory is reported, not thrown")
    void missingDirectory() throws Exception {
        CommandResult result = terminal.execute("ls", workspace.resolve("nope"));

        assertEquals(-1, result.returnCode());
        assertFalse(result.stderr().isEmpty());
    }
}
