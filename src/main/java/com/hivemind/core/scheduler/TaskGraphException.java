package com.hivemind.core.scheduler;

/**
 * Base type for task board rule violations.
 */
public class TaskGraphException extends RuntimeException {
    public TaskGraphException(String message) {
        super(message);
    }
}
