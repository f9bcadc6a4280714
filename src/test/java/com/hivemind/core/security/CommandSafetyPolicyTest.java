package com.hivemind.core.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandSafetyPolicyTest {

    private final CommandSafetyPolicy policy = new CommandSafetyPolicy(new SecurityProperties());

    @Nested
    @DisplayName("safe commands")
    class SafeCommands {

        @ParameterizedTest
        @ValueSource(strings = {"pytest -q", "python3 -m pytest tests/", "ls -la", "cat app.py",
                "grep -rn TODO src", "npm test", "pwd", "  ls  "})
        @DisplayName("known read-only prefixes run without approval")
        void knownPrefixes(String command) {
            assertTrue(policy.isSafe(command));
        }

        @Test
        @DisplayName("grep and cat may pipe")
        void pipeSafePrefixes() {
            assertTrue(policy.isSafe("cat app.log | grep ERROR"));
            assertTrue(policy.isSafe("grep -c def app.py | sort -n"));
        }
    }

    @Nested
    @DisplayName("gated commands")
    class GatedCommands {

        @ParameterizedTest
        @ValueSource(strings = {"rm -rf build", "echo hi > out.txt", "cat a >> b", "curl http://example.com",
                "pip install requests", "sudo ls", "ls | tee files.txt", "find . -name x -exec mv {} y"})
        @DisplayName("destructive substrings need approval even after a safe prefix")
        void destructivePatterns(String command) {
            assertFalse(policy.isSafe(command));
        }

        @Test
        @DisplayName("pipes from other commands need approval")
        void otherPipes() {
            assertFalse(policy.isSafe("ls | wc -l"));
        }

        @Test
        @DisplayName("unknown commands need approval")
        void unknownCommand() {
            assertFalse(policy.isSafe("make build"));
            assertFalse(policy.isSafe("python3 app.py"));
        }

        @Test
        @DisplayName("blank commands are never safe")
        void blank() {
            assertFalse(policy.isSafe(""));
            assertFalse(policy.isSafe("   "));
            assertFalse(policy.isSafe(null));
        }
    }

    @Test
    @DisplayName("configured prefixes replace the defaults")
    void configuredPrefixes() {
        SecurityProperties props = new SecurityProperties();
        props.setSafeCommandPrefixes(List.of("make "));
        CommandSafetyPolicy custom = new CommandSafetyPolicy(props);

        assertTrue(custom.isSafe("make build"));
        assertFalse(custom.isSafe("ls"));
    }
}
