package com.hivemind.core.scheduler;

import com.hivemind.core.model.Task;

import java.util.List;

/**
 * A blocked task together with the dependency ids it is still waiting on.
 */
public record BlockedTask(Task task, List<String> waitingOn) {
}
