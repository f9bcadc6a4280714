package com.hivemind.core.scheduler;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;

/**
 * Observer notified after a successful status change.
 */
@FunctionalInterface
public interface TaskStatusListener {
    void onStatusChange(Task task, TaskStatus oldStatus, TaskStatus newStatus);
}
