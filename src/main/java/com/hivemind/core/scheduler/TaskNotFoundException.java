package com.hivemind.core.scheduler;

public class TaskNotFoundException extends TaskGraphException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task " + taskId + " not found");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
