package com.hivemind.core.scheduler;

import com.hivemind.core.model.TaskStatus;

import java.util.List;

/**
 * One node of the dependency view: what a task depends on and what it blocks.
 */
public record DependencyInfo(String title, TaskStatus status, List<String> dependsOn, List<String> blocks) {
}
