package com.hivemind.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Shared file workspace with optimistic concurrency.
 * <p>
 * Every path is resolved against the root and rejected when it escapes it. Mutations of a
 * path are serialized by a per-path {@link ReentrantLock}. The store remembers, per agent,
 * the content hash it last observed for each file; an edit based on an outdated view fails
 * with {@link StaleReadException} so the agent re-reads before changing anything.
 * <p>
 * Reservations are an advisory layer on top: they never take the per-path lock.
 */
@Service
public class WorkspaceStore {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStore.class);

    private static final Set<String> NOISE_DIRS = Set.of("__pycache__", "node_modules", ".git", "venv", ".venv",
            "target", "build");

    private final WorkspaceProperties properties;
    private final Clock clock;
    private final FileTracker fileTracker;

    private final ConcurrentHashMap<String, ReentrantLock> fileLocks = new ConcurrentHashMap<>();
    /** path -> hash of the content last seen on disk */
    private final ConcurrentHashMap<String, String> fileHashes = new ConcurrentHashMap<>();
    /** agentId + '\0' + path -> hash the agent last observed */
    private final ConcurrentHashMap<String, String> agentReads = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, FileReservation> reservations = new ConcurrentHashMap<>();
    /** tie-breaker for backups taken within the same millisecond */
    private final AtomicLong backupSeq = new AtomicLong();

    private volatile Path root;

    public WorkspaceStore(WorkspaceProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.fileTracker = new FileTracker(properties.getActivityWindow(), clock);
    }

    /**
     * Sets the root directory for the mission, creating it when missing.
     */
    public void setRoot(String path) {
        Path resolved = Paths.get(path).toAbsolutePath().normalize();
        try {
            Files.createDirectories(resolved);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create workspace root " + resolved + ": " + e.getMessage(), e);
        }
        if (!Files.isDirectory(resolved)) {
            throw new WorkspaceException("Path is not a directory: " + path);
        }
        this.root = resolved;
        fileLocks.clear();
        fileHashes.clear();
        agentReads.clear();
        reservations.clear();
        log.info("Workspace root set to: {}", resolved);
    }

    public Path getRoot() {
        Path current = root;
        if (current == null) {
            throw new IllegalStateException("Workspace root not set. Call setRoot() first.");
        }
        return current;
    }

    public FileTracker getFileTracker() {
        return fileTracker;
    }

    public boolean exists(String relPath) {
        return Files.isRegularFile(resolve(relPath));
    }

    /**
     * Reads a file and records the observed content hash for the agent.
     *
     * @throws WorkspaceFileNotFoundException if the file does not exist
     */
    public String read(String relPath, String agentId) {
        Path full = resolve(relPath);
        String key = key(full);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            if (!Files.isRegularFile(full)) {
                throw new WorkspaceFileNotFoundException(relPath);
            }
            String content = readString(full);
            String hash = hash(content);
            fileHashes.put(key, hash);
            if (hasText(agentId)) {
                agentReads.put(readKey(agentId, key), hash);
                fileTracker.record(agentId, key, FileTouch.Action.READ);
            }
            return content;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrites (or creates) a file. The prior content, if any, is backed up first.
     */
    public FileDiff write(String relPath, String content, String agentId) {
        Path full = resolve(relPath);
        String key = key(full);
        String newContent = content == null ? "" : content;
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            String oldContent = "";
            if (Files.isRegularFile(full)) {
                oldContent = readString(full);
                backup(key, oldContent);
            }
            createParents(full);
            writeString(full, newContent);

            String newHash = hash(newContent);
            fileHashes.put(key, newHash);
            if (hasText(agentId)) {
                agentReads.put(readKey(agentId, key), newHash);
                fileTracker.record(agentId, key, FileTouch.Action.WRITE);
            }
            log.info("Wrote file: {} ({} chars)", key, newContent.length());
            return diff(key, oldContent, newContent);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the first occurrence of {@code search} with {@code replace}.
     *
     * @throws WorkspaceFileNotFoundException if the file does not exist
     * @throws StaleReadException             if the agent's view of the file is missing or outdated
     * @throws PatternNotFoundException       if the search text is absent
     */
    public FileDiff edit(String relPath, String search, String replace, String agentId) {
        Path full = resolve(relPath);
        String key = key(full);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            if (!Files.isRegularFile(full)) {
                throw new WorkspaceFileNotFoundException(relPath);
            }
            String oldContent = readString(full);
            String currentHash = hash(oldContent);
            fileHashes.put(key, currentHash);

            checkStale(agentId, key, currentHash);

            if (search == null || search.isEmpty() || !oldContent.contains(search)) {
                throw new PatternNotFoundException(key);
            }
            int occurrences = countOccurrences(oldContent, search);
            if (occurrences > 1) {
                log.warn("edit: search text found {} times in {}, replacing first occurrence", occurrences, key);
            }

            List<String> recentWriters = fileTracker.recentWriters(key, agentId);
            if (!recentWriters.isEmpty()) {
                log.warn("File conflict: {} editing '{}' which was recently modified by: {}",
                        agentId, key, String.join(", ", recentWriters));
            }

            backup(key, oldContent);
            int at = oldContent.indexOf(search);
            String newContent = oldContent.substring(0, at) + (replace == null ? "" : replace)
                    + oldContent.substring(at + search.length());
            writeString(full, newContent);

            String newHash = hash(newContent);
            fileHashes.put(key, newHash);
            if (hasText(agentId)) {
                agentReads.put(readKey(agentId, key), newHash);
                fileTracker.record(agentId, key, FileTouch.Action.EDIT);
            }
            log.info("Edited file: {} (replaced {} chars with {} chars)", key, search.length(),
                    replace == null ? 0 : replace.length());
            return diff(key, oldContent, newContent);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true when a file was removed
     */
    public boolean delete(String relPath) {
        Path full = resolve(relPath);
        String key = key(full);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            if (!Files.isRegularFile(full)) {
                return false;
            }
            Files.delete(full);
            fileHashes.remove(key);
            agentReads.keySet().removeIf(k -> k.endsWith("\0" + key));
            log.info("Deleted file: {}", key);
            return true;
        } catch (IOException e) {
            throw new WorkspaceException("Cannot delete " + key + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lists one directory level, skipping hidden entries (except .env) and noise directories.
     */
    public List<FileEntry> list(String relPath) {
        Path target = hasText(relPath) ? resolve(relPath) : getRoot();
        if (!Files.isDirectory(target)) {
            return List.of();
        }
        List<FileEntry> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(target)) {
            for (Path entry : children.sorted().toList()) {
                String name = entry.getFileName().toString();
                if (isSkipped(name)) {
                    continue;
                }
                if (Files.isDirectory(entry)) {
                    entries.add(new FileEntry(name, key(entry), true, 0, countChildren(entry)));
                } else {
                    entries.add(new FileEntry(name, key(entry), false, Files.size(entry), 0));
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", target, e.getMessage());
        }
        return entries;
    }

    /**
     * Lists all files below the root, descending at most {@code maxDepth} directory levels.
     */
    public List<FileEntry> listRecursive(int maxDepth) {
        Path base = getRoot();
        List<FileEntry> files = new ArrayList<>();
        collect(base, 0, maxDepth, files);
        files.sort(Comparator.comparing(FileEntry::path));
        return files;
    }

    // --- Reservations ---

    /**
     * Claims a path for the agent. Re-reserving by the holder refreshes the claim.
     *
     * @return false when another agent holds a live reservation
     */
    public boolean reserve(String relPath, String agentId) {
        String key = key(resolve(relPath));
        Instant now = clock.instant();
        Duration ttl = properties.getReservationTtl();
        FileReservation result = reservations.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now) || existing.holder().equals(agentId)) {
                return new FileReservation(k, agentId, now, ttl);
            }
            return existing;
        });
        boolean granted = result.holder().equals(agentId);
        if (granted) {
            log.info("File {} reserved by {}", key, agentId);
        } else {
            log.info("Reservation of {} by {} denied, held by {}", key, agentId, result.holder());
        }
        return granted;
    }

    /**
     * Releases a reservation. Only the holder may release.
     */
    public boolean release(String relPath, String agentId) {
        String key = key(resolve(relPath));
        FileReservation existing = reservations.get(key);
        if (existing == null || !existing.holder().equals(agentId)) {
            return false;
        }
        boolean removed = reservations.remove(key, existing);
        if (removed) {
            log.info("File {} released by {}", key, agentId);
        }
        return removed;
    }

    public int releaseAll(String agentId) {
        List<String> held = reservations.values().stream()
                .filter(r -> r.holder().equals(agentId))
                .map(FileReservation::path)
                .toList();
        int released = 0;
        for (String path : held) {
            FileReservation r = reservations.get(path);
            if (r != null && r.holder().equals(agentId) && reservations.remove(path, r)) {
                released++;
            }
        }
        return released;
    }

    /**
     * Current live holder of a path, evaluating expiry lazily.
     */
    public Optional<String> reservationHolder(String relPath) {
        String key = key(resolve(relPath));
        FileReservation r = reservations.get(key);
        if (r == null) {
            return Optional.empty();
        }
        if (r.isExpired(clock.instant())) {
            reservations.remove(key, r);
            return Optional.empty();
        }
        return Optional.of(r.holder());
    }

    public List<FileReservation> reservations() {
        Instant now = clock.instant();
        reservations.values().removeIf(r -> r.isExpired(now));
        return reservations.values().stream()
                .sorted(Comparator.comparing(FileReservation::path))
                .toList();
    }

    // --- internals ---

    Path resolve(String relPath) {
        Path base = getRoot();
        String cleaned = relPath == null ? "" : relPath.trim();
        Path full = base.resolve(cleaned).normalize();
        if (!full.startsWith(base)) {
            throw new PathEscapeException(relPath);
        }
        return full;
    }

    private String key(Path full) {
        return getRoot().relativize(full).toString().replace('\\', '/');
    }

    private ReentrantLock lockFor(String key) {
        return fileLocks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    int lockCount() {
        return fileLocks.size();
    }

    private void checkStale(String agentId, String key, String currentHash) {
        if (!hasText(agentId)) {
            return;
        }
        String observed = agentReads.get(readKey(agentId, key));
        if (observed == null) {
            throw new StaleReadException(key, "You haven't read '" + key + "' yet. "
                    + "Use read_file first before modifying it.");
        }
        if (!observed.equals(currentHash)) {
            throw new StaleReadException(key, "File '" + key + "' was modified by another agent since you last "
                    + "read it. Use read_file to get the latest content before editing.");
        }
    }

    private FileDiff diff(String path, String oldContent, String newContent) {
        List<String> newLines = newContent.lines().toList();
        if (oldContent.isEmpty()) {
            StringBuilder sb = new StringBuilder("+++ ").append(path).append(" (new file)");
            newLines.stream().limit(properties.getNewFilePreviewLines())
                    .forEach(line -> sb.append("\n+").append(line));
            return new FileDiff(path, FileDiff.ChangeType.CREATED, newLines.size(), 0, sb.toString());
        }
        List<String> lines = LineDiff.unified(path, oldContent.lines().toList(), newLines);
        int additions = 0;
        int deletions = 0;
        for (String line : lines) {
            if (line.startsWith("+") && !line.startsWith("+++")) {
                additions++;
            } else if (line.startsWith("-") && !line.startsWith("---")) {
                deletions++;
            }
        }
        String text = String.join("\n", lines.subList(0, Math.min(lines.size(), properties.getMaxDiffLines())));
        return new FileDiff(path, FileDiff.ChangeType.MODIFIED, additions, deletions, text);
    }

    private void backup(String key, String content) {
        Path backupDir = getRoot().resolve(properties.getBackupDir());
        String flat = key.replace("/", "__");
        Path backup = backupDir.resolve(flat + "." + clock.millis() + "-" + backupSeq.incrementAndGet() + ".bak");
        try {
            Files.createDirectories(backupDir);
            writeString(backup, content);
            log.debug("Backup saved: {}", backup.getFileName());
        } catch (IOException e) {
            throw new WorkspaceException("Cannot back up " + key + ": " + e.getMessage(), e);
        }
    }

    private void collect(Path dir, int depth, int maxDepth, List<FileEntry> out) {
        if (depth >= maxDepth) {
            return;
        }
        try (Stream<Path> children = Files.list(dir)) {
            for (Path entry : children.toList()) {
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry)) {
                    if (!name.startsWith(".") && !NOISE_DIRS.contains(name)) {
                        collect(entry, depth + 1, maxDepth, out);
                    }
                } else if (!name.startsWith(".") || ".env".equals(name)) {
                    out.add(new FileEntry(name, key(entry), false, Files.size(entry), 0));
                }
            }
        } catch (IOException e) {
            log.warn("Cannot scan {}: {}", dir, e.getMessage());
        }
    }

    private static boolean isSkipped(String name) {
        if (name.startsWith(".") && !".env".equals(name)) {
            return true;
        }
        return NOISE_DIRS.contains(name);
    }

    private static int countChildren(Path dir) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            return (int) children.count();
        }
    }

    private static void createParents(Path full) {
        try {
            Path parent = full.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create directories for " + full + ": " + e.getMessage(), e);
        }
    }

    private static String readString(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot read " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static void writeString(Path path, String content) {
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot write " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    static String hash(String content) {
        return DigestUtils.md5DigestAsHex(content.getBytes(StandardCharsets.UTF_8));
    }

    private static int countOccurrences(String text, String search) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(search, from)) >= 0) {
            count++;
            from += search.length();
        }
        return count;
    }

    private static String readKey(String agentId, String key) {
        return agentId + "\0" + key;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
