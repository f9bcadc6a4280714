package com.hivemind.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "hivemind.security")
public class SecurityProperties {

    /** Commands starting with one of these run without asking. */
    private List<String> safeCommandPrefixes = new ArrayList<>(List.of(
            "python3 -m pytest", "python -m pytest", "pytest",
            "python3 -m py_compile", "python -m py_compile",
            "python3 -c", "python -c",
            "cat ", "head ", "tail ", "wc ",
            "ls", "find ", "grep ", "rg ",
            "echo ", "pwd", "which ", "whoami",
            "tree ", "file ", "stat ",
            "diff ", "sort ", "uniq ",
            "node -e", "node --version", "npm list", "npm test", "npm run test"));

    /** Substrings that always require approval, even after a safe prefix. */
    private List<String> destructivePatterns = new ArrayList<>(List.of(
            "rm ", "rm -", "rmdir", "mv ", "cp ",
            "pip install", "pip3 install", "npm install", "yarn add",
            "brew ", "apt ", "sudo ",
            "chmod ", "chown ",
            "kill ", "pkill ",
            "curl ", "wget ",
            "> ", ">> ", "| tee"));

    /** Commands allowed to pipe without approval. */
    private List<String> pipeSafePrefixes = new ArrayList<>(List.of("grep ", "cat "));

    public List<String> getSafeCommandPrefixes() {
        return safeCommandPrefixes;
    }

    public void setSafeCommandPrefixes(List<String> safeCommandPrefixes) {
        this.safeCommandPrefixes = safeCommandPrefixes;
    }

    public List<String> getDestructivePatterns() {
        return destructivePatterns;
    }

    public void setDestructivePatterns(List<String> destructivePatterns) {
        this.destructivePatterns = destructivePatterns;
    }

    public List<String> getPipeSafePrefixes() {
        return pipeSafePrefixes;
    }

    public void setPipeSafePrefixes(List<String> pipeSafePrefixes) {
        this.pipeSafePrefixes = pipeSafePrefixes;
    }
}
