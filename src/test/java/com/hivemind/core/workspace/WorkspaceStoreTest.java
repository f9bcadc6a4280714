package com.hivemind.core.workspace;

import com.hivemind.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private WorkspaceStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new WorkspaceStore(new WorkspaceProperties(), clock);
        store.setRoot(tempDir.toString());
    }

    @Nested
    @DisplayName("read and write")
    class ReadWrite {

        @Test
        @DisplayName("write creates parent directories and reports a created diff")
        void writeCreates() throws Exception {
            FileDiff diff = store.write("src/app.py", "print('hi')\nprint('bye')\n", "developer");

            assertEquals("src/app.py", diff.path());
            assertEquals(FileDiff.ChangeType.CREATED, diff.type());
            assertEquals(2, diff.additions());
            assertEquals(0, diff.deletions());
            assertTrue(diff.diff().startsWith("+++ src/app.py (new file)"));
            assertEquals("print('hi')\nprint('bye')\n", Files.readString(tempDir.resolve("src/app.py")));
        }

        @Test
        @DisplayName("overwrite backs up prior content and reports a modified diff")
        void overwriteBacksUp() throws Exception {
            store.write("src/app.py", "a\nb\nc\n", "developer");
            FileDiff diff = store.write("src/app.py", "a\nB\nc\n", "developer");

            assertEquals(FileDiff.ChangeType.MODIFIED, diff.type());
            assertEquals(1, diff.additions());
            assertEquals(1, diff.deletions());
            assertTrue(diff.diff().contains("-b"));
            assertTrue(diff.diff().contains("+B"));

            Path backup = tempDir.resolve(".backups/src__app.py." + clock.millis() + "-1.bak");
            assertTrue(Files.exists(backup));
            assertEquals("a\nb\nc\n", Files.readString(backup));
        }

        @Test
        @DisplayName("overwrites within the same instant each keep their own backup")
        void backupsWithinSameInstant() throws Exception {
            store.write("app.py", "v1", "developer");
            store.write("app.py", "v2", "developer");
            store.write("app.py", "v3", "developer");

            List<String> saved;
            try (Stream<Path> backups = Files.list(tempDir.resolve(".backups"))) {
                saved = backups.map(path -> {
                    try {
                        return Files.readString(path);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }).sorted().toList();
            }
            assertEquals(List.of("v1", "v2"), saved);
        }

        @Test
        @DisplayName("switching the root drops the per-path locks of the previous workspace")
        void setRootDropsLocks(@TempDir Path next) {
            store.write("a.txt", "x", "developer");
            store.write("b.txt", "y", "developer");
            assertEquals(2, store.lockCount());

            store.setRoot(next.toString());

            assertEquals(0, store.lockCount());
            store.write("a.txt", "z", "developer");
            assertEquals(1, store.lockCount());
        }

        @Test
        @DisplayName("read of a missing file raises WorkspaceFileNotFoundException")
        void readMissing() {
            assertThrows(WorkspaceFileNotFoundException.class, () -> store.read("nope.txt", "developer"));
        }

        @Test
        @DisplayName("paths leaving the root are rejected")
        void pathEscape() {
            assertThrows(PathEscapeException.class, () -> store.read("../outside.txt", "developer"));
            assertThrows(PathEscapeException.class, () -> store.write("a/../../x.txt", "x", "developer"));
            assertThrows(PathEscapeException.class, () -> store.reserve("/etc/passwd", "developer"));
        }

        @Test
        @DisplayName("equivalent spellings of a path share one key")
        void normalizesPaths() {
            FileDiff diff = store.write("./src/../app.py", "x", "developer");

            assertEquals("app.py", diff.path());
            assertTrue(store.exists("app.py"));
        }

        @Test
        @DisplayName("delete removes the file and reports whether it existed")
        void delete() {
            store.write("a.txt", "x", "developer");

            assertTrue(store.delete("a.txt"));
            assertFalse(store.delete("a.txt"));
            assertFalse(store.exists("a.txt"));
        }
    }

    @Nested
    @DisplayName("optimistic concurrency")
    class OptimisticConcurrency {

        @Test
        @DisplayName("edit after another agent's write fails until the file is re-read")
        void staleRead() {
            store.write("x.py", "value = 1\n", "setup");
            store.read("x.py", "agent1");
            store.write("x.py", "value = 2\n", "agent2");

            assertThrows(StaleReadException.class,
                    () -> store.edit("x.py", "value = 2", "value = 3", "agent1"));

            store.read("x.py", "agent1");
            FileDiff diff = store.edit("x.py", "value = 2", "value = 3", "agent1");

            assertEquals(1, diff.additions());
            assertEquals("value = 3\n", store.read("x.py", "agent1"));
        }

        @Test
        @DisplayName("editing a file the agent never read is rejected")
        void neverRead() {
            store.write("x.py", "a\n", "agent2");

            assertThrows(StaleReadException.class, () -> store.edit("x.py", "a", "b", "agent1"));
        }

        @Test
        @DisplayName("a write counts as the writer's own observation")
        void writeCountsAsRead() {
            store.write("x.py", "a\n", "agent1");

            FileDiff diff = store.edit("x.py", "a", "b", "agent1");

            assertEquals(FileDiff.ChangeType.MODIFIED, diff.type());
        }

        @Test
        @DisplayName("missing search text raises PatternNotFoundException")
        void patternNotFound() {
            store.write("x.py", "a\n", "agent1");

            assertThrows(PatternNotFoundException.class, () -> store.edit("x.py", "zzz", "b", "agent1"));
        }

        @Test
        @DisplayName("edit replaces only the first occurrence")
        void firstOccurrence() {
            store.write("x.py", "foo foo foo", "agent1");

            store.edit("x.py", "foo", "bar", "agent1");

            assertEquals("bar foo foo", store.read("x.py", "agent1"));
        }

        @Test
        @DisplayName("edit of a missing file raises WorkspaceFileNotFoundException")
        void editMissing() {
            assertThrows(WorkspaceFileNotFoundException.class, () -> store.edit("x.py", "a", "b", "agent1"));
        }

        @Test
        @DisplayName("external modification on disk is detected as stale")
        void externalModification() throws Exception {
            store.write("x.py", "a\n", "agent1");
            Files.writeString(tempDir.resolve("x.py"), "changed\n");

            assertThrows(StaleReadException.class, () -> store.edit("x.py", "changed", "b", "agent1"));
        }
    }

    @Nested
    @DisplayName("reservations")
    class Reservations {

        @Test
        @DisplayName("a second agent cannot reserve until the holder releases")
        void exclusive() {
            assertTrue(store.reserve("app.py", "A"));
            assertFalse(store.reserve("app.py", "B"));
            assertEquals(Optional.of("A"), store.reservationHolder("app.py"));

            assertFalse(store.release("app.py", "B"));
            assertTrue(store.release("app.py", "A"));
            assertTrue(store.reserve("app.py", "B"));
        }

        @Test
        @DisplayName("holder re-reserving refreshes the claim")
        void refresh() {
            store.reserve("app.py", "A");
            clock.advanceSeconds(240);
            assertTrue(store.reserve("app.py", "A"));
            clock.advanceSeconds(120);

            assertFalse(store.reserve("app.py", "B"));
        }

        @Test
        @DisplayName("reservations expire after the TTL")
        void expiry() {
            store.reserve("app.py", "A");
            clock.advanceSeconds(301);

            assertEquals(Optional.empty(), store.reservationHolder("app.py"));
            assertTrue(store.reserve("app.py", "B"));
        }

        @Test
        @DisplayName("releaseAll drops every reservation of one agent")
        void releaseAll() {
            store.reserve("a.py", "A");
            store.reserve("b.py", "A");
            store.reserve("c.py", "B");

            assertEquals(2, store.releaseAll("A"));
            assertEquals(List.of("c.py"), store.reservations().stream().map(FileReservation::path).toList());
        }

        @Test
        @DisplayName("reservations do not block writes")
        void advisoryOnly() {
            store.reserve("app.py", "A");

            FileDiff diff = store.write("app.py", "x", "B");

            assertEquals(FileDiff.ChangeType.CREATED, diff.type());
        }
    }

    @Nested
    @DisplayName("listing")
    class Listing {

        @Test
        @DisplayName("list skips hidden entries and noise directories")
        void listSkipsNoise() throws Exception {
            store.write("src/app.py", "x", "developer");
            store.write("README.md", "x", "developer");
            store.write(".env", "K=V", "developer");
            store.write(".secret", "x", "developer");
            Files.createDirectories(tempDir.resolve("node_modules/pkg"));

            List<String> names = store.list("").stream().map(FileEntry::name).toList();

            assertEquals(List.of(".env", "README.md", "src"), names);
            FileEntry src = store.list("").stream().filter(FileEntry::directory).findFirst().orElseThrow();
            assertEquals(1, src.children());
        }

        @Test
        @DisplayName("listRecursive honours the depth limit")
        void recursiveDepth() {
            store.write("a.txt", "x", "d");
            store.write("one/b.txt", "x", "d");
            store.write("one/two/c.txt", "x", "d");

            List<String> shallow = store.listRecursive(2).stream().map(FileEntry::path).toList();
            List<String> deep = store.listRecursive(4).stream().map(FileEntry::path).toList();

            assertEquals(List.of("a.txt", "one/b.txt"), shallow);
            assertEquals(List.of("a.txt", "one/b.txt", "one/two/c.txt"), deep);
        }

        @Test
        @DisplayName("backups are hidden from listings")
        void backupsHidden() throws Exception {
            store.write("a.txt", "1", "d");
            store.write("a.txt", "2", "d");

            try (Stream<Path> backups = Files.list(tempDir.resolve(".backups"))) {
                assertEquals(1, backups.count());
            }
            assertEquals(List.of("a.txt"), store.listRecursive(4).stream().map(FileEntry::path).toList());
        }
    }

    @Test
    @DisplayName("file activity is tracked per agent")
    void tracksActivity() {
        store.write("x.py", "a", "agent1");
        store.read("x.py", "agent2");

        assertEquals(List.of("agent1"), store.getFileTracker().recentWriters("x.py", "agent2"));
        assertEquals(List.of("agent1", "agent2"), store.getFileTracker().recentAgents("x.py", null));
    }
}
