package com.hivemind.core.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Walks the mission workspace and builds a markdown summary for the planner's prompt:
 * the file tree, the detected build manifest, and the contents of small key files.
 * <p>
 * Common build-tool, VCS and IDE directories (e.g. {@code .git}, {@code node_modules},
 * {@code target}) are excluded, as are hidden files other than {@code .env.example}.
 */
@Service
public class CodebaseScanner {

    private static final Logger log = LoggerFactory.getLogger(CodebaseScanner.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next",
            "venv", ".venv", ".backups"
    );

    private static final Set<String> KEY_FILENAMES = Set.of(
            "README.md", "readme.md", "README",
            "package.json", "requirements.txt", "Cargo.toml",
            "Makefile", "Dockerfile", "docker-compose.yml",
            "pyproject.toml", "setup.py", "setup.cfg",
            "tsconfig.json", "pom.xml", "build.gradle", "go.mod",
            ".env.example"
    );

    private static final Set<String> ENTRY_POINTS = Set.of(
            "main.py", "app.py", "index.js", "index.ts", "main.go", "main.rs", "Main.java"
    );

    static final int MAX_DEPTH = 3;
    static final int MAX_TREE_LINES = 100;
    static final long MAX_KEY_FILE_SIZE = 10_000;
    static final long MAX_TOTAL_KEY_SIZE = 80_000;

    /**
     * Never throws: an unreadable workspace produces a one-line summary.
     */
    public String summarize(Path root) {
        List<Path> files = new ArrayList<>();
        try (var stream = Files.walk(root, MAX_DEPTH)) {
            stream.filter(Files::isRegularFile)
                  .filter(p -> !shouldIgnore(root, p))
                  .sorted()
                  .forEach(files::add);
        } catch (IOException e) {
            log.error("Codebase scan failed for {}", root, e);
            return "Empty or inaccessible workspace.";
        }
        if (files.isEmpty()) {
            return "Empty workspace, starting from scratch.";
        }

        var sb = new StringBuilder("# Existing Codebase Analysis\n\n## Project Structure\n");
        int lines = 0;
        Set<String> extensions = new TreeSet<>();
        for (Path file : files) {
            String relative = root.relativize(file).toString().replace('\\', '/');
            String ext = extension(file);
            if (!ext.isEmpty()) {
                extensions.add(ext);
            }
            if (lines++ < MAX_TREE_LINES) {
                String indent = "  ".repeat((int) relative.chars().filter(c -> c == '/').count());
                sb.append(indent).append(relative)
                  .append(String.format(Locale.ROOT, " (%.1fKB)", size(file) / 1024.0))
                  .append('\n');
            }
        }

        sb.append("\n## Key Files\n\n");
        long total = 0;
        boolean anyKey = false;
        for (Path file : files) {
            String name = file.getFileName().toString();
            if (!KEY_FILENAMES.contains(name) && !ENTRY_POINTS.contains(name)) {
                continue;
            }
            long size = size(file);
            if (size >= MAX_KEY_FILE_SIZE) {
                continue;
            }
            if (total > MAX_TOTAL_KEY_SIZE) {
                break;
            }
            try {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                sb.append("### ").append(root.relativize(file)).append("\n```\n").append(content).append("\n```\n\n");
                total += content.length();
                anyKey = true;
            } catch (IOException e) {
                log.debug("Skipping unreadable key file {}: {}", file, e.getMessage());
            }
        }
        if (!anyKey) {
            sb.append("No key configuration files found.\n\n");
        }

        sb.append("## Summary\n");
        sb.append("- Total files: ").append(files.size()).append('\n');
        sb.append("- Languages detected: ").append(String.join(", ", extensions)).append('\n');
        log.info("Codebase scanned: {} files, {} chars of summary", files.size(), sb.length());
        return sb.toString();
    }

    /**
     * Returns {@code true} if any component of the path is an ignored directory or a hidden file.
     */
    private boolean shouldIgnore(Path root, Path path) {
        for (Path component : root.relativize(path)) {
            String name = component.toString();
            if (IGNORE_DIRS.contains(name)) return true;
            if (name.startsWith(".") && !name.equals(".env.example")) return true;
        }
        return false;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot);
    }

    private static long size(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0;
        }
    }
}
