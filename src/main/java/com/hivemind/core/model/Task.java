package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A unit of work on the shared task board. Instances are immutable; the
 * {@link com.hivemind.core.scheduler.TaskGraph} replaces them on every change.
 *
 * @param id              short unique identifier (8 hex characters)
 * @param title           one-line summary
 * @param description     what the assignee should accomplish
 * @param status          current workflow status
 * @param priority        scheduling priority
 * @param assignee        agent id responsible for the task (nullable)
 * @param createdBy       agent id that created the task
 * @param createdAt       creation time
 * @param updatedAt       time of the last mutation
 * @param dependencies    ids of tasks that must be DONE first
 * @param tags            free-form labels
 * @param requiresReview  whether a reviewer must sign off before DONE
 * @param requiresTesting whether a tester is expected to sign off
 * @param reviewedBy      reviewer that signed off (nullable)
 * @param testedBy        tester that signed off (nullable)
 * @param handoffTo       agent the task is being handed to (nullable)
 * @param handoffReason   why the handoff happened (nullable)
 */
public record Task(
    String id,
    String title,
    String description,
    TaskStatus status,
    TaskPriority priority,
    String assignee,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    List<String> dependencies,
    List<String> tags,
    boolean requiresReview,
    boolean requiresTesting,
    String reviewedBy,
    String testedBy,
    String handoffTo,
    String handoffReason
) implements Serializable {

    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        tags = tags == null ? List.of() : List.copyOf(tags);
        priority = priority == null ? TaskPriority.MEDIUM : priority;
    }

    public Task withStatus(TaskStatus newStatus, Instant now) {
        return new Task(id, title, description, newStatus, priority, assignee, createdBy, createdAt, now,
                dependencies, tags, requiresReview, requiresTesting, reviewedBy, testedBy, handoffTo, handoffReason);
    }

    public Task withAssignee(String newAssignee, Instant now) {
        return new Task(id, title, description, status, priority, newAssignee, createdBy, createdAt, now,
                dependencies, tags, requiresReview, requiresTesting, reviewedBy, testedBy, handoffTo, handoffReason);
    }

    public Task withDependencies(List<String> newDependencies, Instant now) {
        return new Task(id, title, description, status, priority, assignee, createdBy, createdAt, now,
                newDependencies, tags, requiresReview, requiresTesting, reviewedBy, testedBy, handoffTo, handoffReason);
    }

    public Task withReviewedBy(String reviewer, Instant now) {
        return new Task(id, title, description, status, priority, assignee, createdBy, createdAt, now,
                dependencies, tags, requiresReview, requiresTesting, reviewer, testedBy, handoffTo, handoffReason);
    }

    public Task withTestedBy(String tester, Instant now) {
        return new Task(id, title, description, status, priority, assignee, createdBy, createdAt, now,
                dependencies, tags, requiresReview, requiresTesting, reviewedBy, tester, handoffTo, handoffReason);
    }

    public Task withHandoff(String target, String reason, Instant now) {
        return new Task(id, title, description, status, priority, assignee, createdBy, createdAt, now,
                dependencies, tags, requiresReview, requiresTesting, reviewedBy, testedBy, target, reason);
    }

    /**
     * Short human-readable reference, e.g. {@code [3fa9c2d1] Add login form}.
     */
    public String label() {
        return "[" + id + "] " + title;
    }
}
