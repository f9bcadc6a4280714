package com.hivemind.core.scheduler;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Shared task board with a dependency graph and an enforced workflow.
 * <p>
 * Tasks move {@code todo -> in_progress -> in_review -> done}, with {@code blocked}
 * managed automatically from dependency state. The planner identity may override any
 * transition. All mutations are serialized on the graph instance.
 */
@Service
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private static final Map<TaskStatus, Set<TaskStatus>> VALID_TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        VALID_TRANSITIONS.put(TaskStatus.TODO, EnumSet.of(TaskStatus.IN_PROGRESS, TaskStatus.BLOCKED));
        VALID_TRANSITIONS.put(TaskStatus.BLOCKED, EnumSet.of(TaskStatus.TODO, TaskStatus.IN_PROGRESS));
        VALID_TRANSITIONS.put(TaskStatus.IN_PROGRESS,
                EnumSet.of(TaskStatus.IN_REVIEW, TaskStatus.BLOCKED, TaskStatus.TODO));
        // review can reject back to in_progress
        VALID_TRANSITIONS.put(TaskStatus.IN_REVIEW, EnumSet.of(TaskStatus.DONE, TaskStatus.IN_PROGRESS));
        VALID_TRANSITIONS.put(TaskStatus.DONE, EnumSet.noneOf(TaskStatus.class));
    }

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final List<TaskStatusListener> listeners = new CopyOnWriteArrayList<>();
    private final String plannerId;
    private final Clock clock;
    private boolean planningComplete;

    public TaskGraph(TaskProperties properties, Clock clock) {
        this.plannerId = properties.getPlannerId();
        this.clock = clock;
    }

    public static Set<TaskStatus> allowedTransitions(TaskStatus from) {
        return Set.copyOf(VALID_TRANSITIONS.get(from));
    }

    public String getPlannerId() {
        return plannerId;
    }

    /**
     * Registers an observer for successful status changes. Observer failures are logged.
     */
    public void onStatusChange(TaskStatusListener listener) {
        listeners.add(listener);
    }

    public Task createTask(String title, String description, String createdBy) {
        return createTask(title, description, createdBy, null, List.of(), List.of(),
                TaskPriority.MEDIUM, true, false);
    }

    /**
     * Creates a task. Unknown dependency ids are dropped; a dependency set that would
     * close a cycle is discarded entirely. The task starts BLOCKED when any accepted
     * dependency is not yet done.
     */
    public synchronized Task createTask(String title, String description, String createdBy, String assignee,
                                        List<String> dependencies, List<String> tags, TaskPriority priority,
                                        boolean requiresReview, boolean requiresTesting) {
        String taskId = newTaskId();

        List<String> validDeps = new ArrayList<>();
        for (String depId : dependencies == null ? List.<String>of() : dependencies) {
            if (tasks.containsKey(depId)) {
                if (!validDeps.contains(depId)) {
                    validDeps.add(depId);
                }
            } else {
                log.warn("Task [{}] dependency '{}' not found, skipping", taskId, depId);
            }
        }

        if (!validDeps.isEmpty() && wouldCreateCycle(taskId, validDeps)) {
            log.error("Task [{}] would create a dependency cycle, dropping its dependencies", taskId);
            validDeps.clear();
        }

        boolean hasUnresolved = validDeps.stream()
                .anyMatch(d -> tasks.get(d).status() != TaskStatus.DONE);
        TaskStatus initial = hasUnresolved ? TaskStatus.BLOCKED : TaskStatus.TODO;

        Instant now = clock.instant();
        Task task = new Task(taskId, title, description == null ? "" : description, initial, priority,
                blankToNull(assignee), createdBy, now, now, validDeps, tags, requiresReview, requiresTesting,
                null, null, null, null);
        tasks.put(taskId, task);
        log.info("Task created: {} -> {}{}", task.label(), assignee == null ? "unassigned" : assignee,
                hasUnresolved ? " (blocked, waiting on " + validDeps + ")" : "");
        return task;
    }

    /**
     * Moves a task to a new status.
     *
     * @throws TaskNotFoundException      if the id is unknown
     * @throws InvalidTransitionException if the actor is not the planner and the edge is not allowed
     * @throws ReviewRequiredException    if the task needs a review sign-off before done
     */
    public synchronized Task updateStatus(String taskId, TaskStatus newStatus, String actorId) {
        Task task = require(taskId);
        TaskStatus oldStatus = task.status();

        if (!plannerId.equals(actorId) && !VALID_TRANSITIONS.get(oldStatus).contains(newStatus)) {
            throw new InvalidTransitionException(taskId, oldStatus, newStatus, VALID_TRANSITIONS.get(oldStatus));
        }

        if (newStatus == TaskStatus.IN_PROGRESS) {
            List<Task> unresolved = unresolvedDependencies(task);
            if (!unresolved.isEmpty()) {
                Task blocked = task.withStatus(TaskStatus.BLOCKED, clock.instant());
                tasks.put(taskId, blocked);
                log.warn("Task [{}] blocked, waiting on: {}", taskId,
                        unresolved.stream().map(Task::label).toList());
                return blocked;
            }
        }

        if (newStatus == TaskStatus.DONE && task.requiresReview() && task.reviewedBy() == null) {
            throw new ReviewRequiredException(taskId);
        }

        Task updated = task.withStatus(newStatus, clock.instant());
        tasks.put(taskId, updated);
        log.info("Task [{}] {} -> {} by {}", taskId, oldStatus.wireName(), newStatus.wireName(), actorId);

        for (TaskStatusListener listener : listeners) {
            notifySafely(listener, updated, oldStatus, newStatus);
        }

        if (newStatus == TaskStatus.DONE) {
            resolveDependents(taskId);
        }
        return updated;
    }

    /**
     * Adds dependencies to an existing task. The same rules as {@link #createTask} apply:
     * unknown ids are dropped and a set that would close a cycle is rejected as a whole.
     * A todo task picking up an unfinished dependency becomes blocked.
     *
     * @return the updated task (unchanged when nothing was accepted)
     */
    public synchronized Task addDependencies(String taskId, List<String> dependencyIds) {
        Task task = require(taskId);
        List<String> accepted = new ArrayList<>();
        for (String depId : dependencyIds == null ? List.<String>of() : dependencyIds) {
            if (depId.equals(taskId) || task.dependencies().contains(depId) || accepted.contains(depId)) {
                continue;
            }
            if (tasks.containsKey(depId)) {
                accepted.add(depId);
            } else {
                log.warn("Task [{}] dependency '{}' not found, skipping", taskId, depId);
            }
        }
        if (accepted.isEmpty()) {
            return task;
        }
        if (wouldCreateCycle(taskId, accepted)) {
            log.error("Dependencies {} on task [{}] would create a cycle, ignoring them", accepted, taskId);
            return task;
        }

        List<String> merged = new ArrayList<>(task.dependencies());
        merged.addAll(accepted);
        Task updated = task.withDependencies(merged, clock.instant());
        if (updated.status() == TaskStatus.TODO && !unresolvedDependencies(updated).isEmpty()) {
            updated = updated.withStatus(TaskStatus.BLOCKED, clock.instant());
        }
        tasks.put(taskId, updated);
        log.info("Task [{}] now depends on {}", taskId, merged);
        return updated;
    }

    public synchronized Task markReviewed(String taskId, String reviewerId) {
        Task updated = require(taskId).withReviewedBy(reviewerId, clock.instant());
        tasks.put(taskId, updated);
        log.info("Task [{}] reviewed by {}", taskId, reviewerId);
        return updated;
    }

    public synchronized Task markTested(String taskId, String testerId) {
        Task updated = require(taskId).withTestedBy(testerId, clock.instant());
        tasks.put(taskId, updated);
        log.info("Task [{}] tested by {}", taskId, testerId);
        return updated;
    }

    public synchronized Task assignTask(String taskId, String assignee) {
        Task updated = require(taskId).withAssignee(blankToNull(assignee), clock.instant());
        tasks.put(taskId, updated);
        log.info("Task [{}] assigned to {}", taskId, assignee);
        return updated;
    }

    public synchronized Task setHandoff(String taskId, String targetAgent, String reason) {
        Task updated = require(taskId).withHandoff(targetAgent, reason == null ? "" : reason, clock.instant());
        tasks.put(taskId, updated);
        log.info("Task [{}] handoff -> {}: {}", taskId, targetAgent, reason);
        return updated;
    }

    public synchronized Task clearHandoff(String taskId) {
        Task updated = require(taskId).withHandoff(null, null, clock.instant());
        tasks.put(taskId, updated);
        return updated;
    }

    public synchronized List<Task> pendingHandoffs(String agentId) {
        return tasks.values().stream()
                .filter(t -> agentId.equals(t.handoffTo()))
                .toList();
    }

    public synchronized Optional<Task> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public synchronized List<Task> tasksFor(String agentId) {
        return tasks.values().stream()
                .filter(t -> agentId.equals(t.assignee()))
                .toList();
    }

    public synchronized List<Task> tasksByStatus(TaskStatus status) {
        return tasks.values().stream()
                .filter(t -> t.status() == status)
                .toList();
    }

    /**
     * Tasks assigned to the agent that it can work on right now (todo or in progress).
     */
    public synchronized List<Task> getActionableTasks(String agentId) {
        return tasks.values().stream()
                .filter(t -> agentId.equals(t.assignee()))
                .filter(t -> t.status() == TaskStatus.TODO || t.status() == TaskStatus.IN_PROGRESS)
                .toList();
    }

    public synchronized List<BlockedTask> blockedTasks() {
        List<BlockedTask> result = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.status() == TaskStatus.BLOCKED) {
                result.add(new BlockedTask(task, unresolvedDependencies(task).stream().map(Task::id).toList()));
            }
        }
        return result;
    }

    public synchronized List<Task> listTasks() {
        return List.copyOf(tasks.values());
    }

    /**
     * Count of tasks per status. Every status is present, possibly with zero.
     */
    public synchronized Map<TaskStatus, Integer> summary() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        for (Task task : tasks.values()) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        return counts;
    }

    public synchronized Map<String, DependencyInfo> dependencyGraph() {
        Map<String, DependencyInfo> graph = new LinkedHashMap<>();
        for (Task task : tasks.values()) {
            List<String> blocks = tasks.values().stream()
                    .filter(t -> t.dependencies().contains(task.id()))
                    .map(Task::id)
                    .toList();
            graph.put(task.id(), new DependencyInfo(task.title(), task.status(), task.dependencies(), blocks));
        }
        return graph;
    }

    public synchronized boolean hasTasks() {
        return !tasks.isEmpty();
    }

    /**
     * Called by the planner once the initial plan exists; enables completion checks.
     */
    public synchronized void markPlanningComplete() {
        planningComplete = true;
        log.info("Planning phase complete, completion checks enabled");
    }

    public synchronized boolean isPlanningComplete() {
        return planningComplete;
    }

    public synchronized boolean allDone() {
        if (!planningComplete || tasks.isEmpty()) {
            return false;
        }
        return tasks.values().stream().allMatch(t -> t.status() == TaskStatus.DONE);
    }

    public synchronized void clear() {
        tasks.clear();
        planningComplete = false;
    }

    // --- Dependency graph internals ---

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    private List<Task> unresolvedDependencies(Task task) {
        return task.dependencies().stream()
                .map(tasks::get)
                .filter(dep -> dep != null && dep.status() != TaskStatus.DONE)
                .toList();
    }

    private void resolveDependents(String completedId) {
        int unblocked = 0;
        for (Task task : List.copyOf(tasks.values())) {
            if (task.status() != TaskStatus.BLOCKED || !task.dependencies().contains(completedId)) {
                continue;
            }
            if (unresolvedDependencies(task).isEmpty()) {
                tasks.put(task.id(), task.withStatus(TaskStatus.TODO, clock.instant()));
                unblocked++;
                log.info("Task [{}] unblocked, all dependencies resolved", task.id());
            }
        }
        if (unblocked > 0) {
            log.info("Unblocked {} task(s) after [{}] completed", unblocked, completedId);
        }
    }

    /**
     * Breadth-first walk from each new dependency looking for the new task id.
     */
    private boolean wouldCreateCycle(String taskId, Collection<String> newDeps) {
        for (String depId : newDeps) {
            Set<String> visited = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(depId);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                if (current.equals(taskId)) {
                    return true;
                }
                if (!visited.add(current)) {
                    continue;
                }
                Task node = tasks.get(current);
                if (node != null) {
                    queue.addAll(node.dependencies());
                }
            }
        }
        return false;
    }

    private String newTaskId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (tasks.containsKey(id));
        return id;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private void notifySafely(TaskStatusListener listener, Task task, TaskStatus oldStatus, TaskStatus newStatus) {
        try {
            listener.onStatusChange(task, oldStatus, newStatus);
        } catch (Exception e) {
            log.warn("Status listener threw exception for task {}: {}", task.id(), e.getMessage(), e);
        }
    }
}
