package com.hivemind.core.scheduler;

/**
 * Thrown when a task that requires review is moved to DONE before a reviewer signed off.
 */
public class ReviewRequiredException extends TaskGraphException {
    public ReviewRequiredException(String taskId) {
        super("Task " + taskId + " requires a review sign-off before it can be marked done");
    }
}
