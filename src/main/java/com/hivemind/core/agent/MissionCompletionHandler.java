package com.hivemind.core.agent;

import com.hivemind.core.bus.MessageType;
import com.hivemind.core.model.Lesson;
import com.hivemind.core.model.MissionRecord;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Finishes a mission exactly once, whichever agent gets there first: the planner on
 * {@code done}, the last {@code update_task}, or an agent that ran out of budget.
 */
public class MissionCompletionHandler {

    private static final Logger log = LoggerFactory.getLogger(MissionCompletionHandler.class);

    public static final String COMPLETED = "completed";
    public static final String STOPPED = "stopped";
    public static final String BUDGET_EXHAUSTED = "budget_exhausted";
    public static final String PROVIDERS_EXHAUSTED = "providers_exhausted";

    private static final int MAX_SUCCESS_LESSONS = 3;

    private final SwarmContext context;
    private final MissionInfo mission;
    private final List<AgentRuntime> agents = new CopyOnWriteArrayList<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final CompletableFuture<MissionRecord> result = new CompletableFuture<>();

    public MissionCompletionHandler(SwarmContext context, MissionInfo mission) {
        this.context = context;
        this.mission = mission;
    }

    public MissionInfo mission() {
        return mission;
    }

    public void register(AgentRuntime agent) {
        agents.add(agent);
    }

    public List<AgentRuntime> agents() {
        return List.copyOf(agents);
    }

    public boolean isCompleted() {
        return completed.get();
    }

    /**
     * Completes when the mission record has been written.
     */
    public CompletableFuture<MissionRecord> result() {
        return result;
    }

    /**
     * Runs the completion sequence. Later calls are no-ops.
     *
     * @param trigger the agent that finished the mission, or null when stopped from outside
     * @param status  "completed", "stopped", "budget_exhausted" or "providers_exhausted"
     * @return the saved record, or empty if the mission was already completed
     */
    public Optional<MissionRecord> complete(AgentRuntime trigger, String status) {
        if (!completed.compareAndSet(false, true)) {
            return Optional.empty();
        }
        String triggerId = trigger == null ? "system" : trigger.getAgentId();
        String triggerRole = trigger == null ? "system" : trigger.getRole().name();
        log.info("Mission {} finishing with status {} (triggered by {})", mission.id(), status, triggerId);

        List<Task> tasks = context.tasks().listTasks();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tasks", tasks);
        data.put("summary", summaryByWireName());
        data.put("status", status);
        String content = COMPLETED.equals(status)
                ? "Mission complete, all tasks finished"
                : "Mission ended: " + status;
        context.bus().publish(triggerId, triggerRole, MessageType.MISSION_COMPLETE, content, data, List.of());

        Instant now = context.clock().instant();
        Duration elapsed = Duration.between(mission.startedAt(), now);
        MissionRecord record = new MissionRecord(
                mission.id(),
                mission.goal(),
                mission.workspace().toString(),
                tasks,
                context.router().globalUsage().costUsd(),
                elapsed.toMillis() / 1000.0,
                agents.stream().map(AgentRuntime::getAgentId).toList(),
                status,
                now);
        context.missions().saveMission(record);

        saveSuccessLessons(tasks, triggerRole, now);

        for (AgentRuntime agent : agents) {
            agent.stop();
        }

        String commitMessage = COMPLETED.equals(status)
                ? "Mission complete: all tasks done"
                : "Mission ended: " + status;
        context.git().autoCommit(commitMessage)
                .ifPresent(sha -> log.info("Mission {} committed as {}", mission.id(), sha));

        context.metrics().recordMissionResult(status);
        context.metrics().recordMissionDuration(elapsed);

        result.complete(record);
        return Optional.of(record);
    }

    private void saveSuccessLessons(List<Task> tasks, String triggerRole, Instant now) {
        tasks.stream()
                .filter(t -> t.status() == TaskStatus.DONE)
                .limit(MAX_SUCCESS_LESSONS)
                .forEach(t -> {
                    String role = t.assignee() != null ? t.assignee() : triggerRole;
                    context.lessons().saveLesson(Lesson.of(role, "Successfully completed: " + t.title(),
                            t.description(), mission.id(), "pattern", now));
                });
    }

    private Map<String, Integer> summaryByWireName() {
        Map<String, Integer> summary = new LinkedHashMap<>();
        context.tasks().summary().forEach((status, count) -> summary.put(status.wireName(), count));
        return summary;
    }
}
