package com.hivemind.core.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskFailureTrackerTest {

    private final TaskFailureTracker tracker = new TaskFailureTracker();

    @Test
    @DisplayName("counts failures per task and remembers the last error")
    void counts() {
        tracker.recordFailure("t1", "[edit_file error]: Search text not found");
        tracker.recordFailure("t1", "[Command output]: Return code: 1");
        tracker.recordFailure("t2", "boom");

        assertEquals(2, tracker.failureCount("t1"));
        assertEquals(1, tracker.failureCount("t2"));
        assertEquals("[Command output]: Return code: 1", tracker.lastError("t1"));
    }

    @Test
    @DisplayName("reset ends the streak")
    void reset() {
        tracker.recordFailure("t1", "boom");
        tracker.reset("t1");

        assertEquals(0, tracker.failureCount("t1"));
        assertEquals("unknown error", tracker.lastError("t1"));
    }

    @Test
    @DisplayName("A-B-A error pattern is oscillation")
    void oscillation() {
        tracker.recordFailure("t1", "ImportError");
        tracker.recordFailure("t1", "SyntaxError");
        assertFalse(tracker.isOscillating("t1"));

        tracker.recordFailure("t1", "ImportError");
        assertTrue(tracker.isOscillating("t1"));
    }

    @Test
    @DisplayName("repeating the same error is not oscillation")
    void sameErrorRepeated() {
        tracker.recordFailure("t1", "ImportError");
        tracker.recordFailure("t1", "ImportError");
        tracker.recordFailure("t1", "ImportError");

        assertFalse(tracker.isOscillating("t1"));
    }

    @Test
    @DisplayName("a task is reflected on once per streak")
    void reflectedOncePerStreak() {
        tracker.recordFailure("t1", "boom");
        tracker.markReflected("t1");
        tracker.recordFailure("t1", "boom");

        assertTrue(tracker.isReflected("t1"));
        assertFalse(tracker.isReflected("t2"));

        tracker.reset("t1");
        assertFalse(tracker.isReflected("t1"));
    }
}
