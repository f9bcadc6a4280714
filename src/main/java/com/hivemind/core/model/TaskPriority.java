package com.hivemind.core.model;

import java.util.Locale;

/**
 * Priority of a task. Unrecognized values fall back to {@link #MEDIUM}.
 */
public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static TaskPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
