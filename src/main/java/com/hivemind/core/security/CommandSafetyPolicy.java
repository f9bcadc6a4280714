package com.hivemind.core.security;

import org.springframework.stereotype.Service;

/**
 * Decides whether a terminal command may run without a human approving it first.
 */
@Service
public class CommandSafetyPolicy {

    private final SecurityProperties securityProperties;

    public CommandSafetyPolicy(SecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    public boolean isSafe(String command) {
        if (command == null || command.isBlank()) {
            return false;
        }
        String cmd = command.strip();
        for (String pattern : securityProperties.getDestructivePatterns()) {
            if (cmd.contains(pattern)) {
                return false;
            }
        }
        if (cmd.contains("|") && !startsWithAny(cmd, securityProperties.getPipeSafePrefixes())) {
            return false;
        }
        return startsWithAny(cmd, securityProperties.getSafeCommandPrefixes());
    }

    private static boolean startsWithAny(String command, Iterable<String> prefixes) {
        for (String prefix : prefixes) {
            if (command.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
