package com.hivemind.core.scheduler;

import com.hivemind.core.model.TaskStatus;

import java.util.Set;

/**
 * Thrown when a non-planner actor requests a status change that is not an edge
 * of the task workflow.
 */
public class InvalidTransitionException extends TaskGraphException {

    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to, Set<TaskStatus> allowed) {
        super("Cannot move task " + taskId + " from " + from.wireName() + " to " + to.wireName()
                + ". Allowed: " + (allowed.isEmpty() ? "none" : allowed));
        this.from = from;
        this.to = to;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
