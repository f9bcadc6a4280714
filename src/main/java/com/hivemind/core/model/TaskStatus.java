package com.hivemind.core.model;

import java.util.Locale;

/**
 * Workflow status of a task on the shared task board.
 */
public enum TaskStatus {
    TODO,
    BLOCKED,      // waiting on unfinished dependencies
    IN_PROGRESS,
    IN_REVIEW,
    DONE;

    /**
     * Wire name used in agent actions and persisted records (e.g. "in_progress").
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no status
     */
    public static TaskStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task status is required");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown task status: " + value);
        }
    }
}
