package com.hivemind.core.agent;

import com.hivemind.core.bus.Message;
import com.hivemind.core.bus.MessageType;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.Lesson;
import com.hivemind.core.model.MissionRecord;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MissionCompletionHandlerTest {

    @TempDir
    Path root;

    private SwarmFixture f;

    @BeforeEach
    void setUp() {
        f = new SwarmFixture(root);
    }

    private Task finished(String title, String assignee) {
        Task task = f.tasks.createTask(title, "did " + title, "orchestrator", assignee, List.of(), List.of(),
                TaskPriority.MEDIUM, false, false);
        return f.tasks.updateStatus(task.id(), TaskStatus.DONE, "orchestrator");
    }

    @Test
    @DisplayName("writes the mission record with cost, duration and agents")
    void savesRecord() {
        AgentRuntime orchestrator = f.agent("orchestrator");
        f.agent("developer");
        finished("Backend", "developer");
        f.clock.advance(Duration.ofMinutes(2));

        Optional<MissionRecord> result = f.completion.complete(orchestrator, MissionCompletionHandler.COMPLETED);

        MissionRecord record = result.orElseThrow();
        assertEquals("HVMD-2026-0001", record.id());
        assertEquals("Build a todo app", record.goal());
        assertEquals(0.25, record.costUsd());
        assertEquals(120.0, record.durationSeconds());
        assertEquals(List.of("orchestrator", "developer"), record.agents());
        assertEquals("completed", record.status());
        assertEquals(1, record.tasks().size());
        verify(f.missions).saveMission(record);
        assertSame(record, f.completion.result().join());
    }

    @Test
    @DisplayName("announces the result with a task summary")
    void announces() {
        AgentRuntime orchestrator = f.agent("orchestrator");
        finished("Backend", "developer");

        f.completion.complete(orchestrator, MissionCompletionHandler.COMPLETED);

        Message message = f.published(MessageType.MISSION_COMPLETE).get(0);
        assertEquals("orchestrator", message.sender());
        assertEquals("completed", message.data().get("status"));
        assertEquals(1, ((Map<?, ?>) message.data().get("summary")).get("done"));
    }

    @Test
    @DisplayName("runs only once")
    void idempotent() {
        AgentRuntime orchestrator = f.agent("orchestrator");

        assertTrue(f.completion.complete(orchestrator, MissionCompletionHandler.COMPLETED).isPresent());
        assertTrue(f.completion.complete(orchestrator, MissionCompletionHandler.STOPPED).isEmpty());

        verify(f.missions, times(1)).saveMission(any());
        assertEquals(1, f.published(MessageType.MISSION_COMPLETE).size());
    }

    @Test
    @DisplayName("keeps at most three success lessons, attributed to the assignee")
    void successLessons() {
        for (int i = 1; i <= 5; i++) {
            finished("Task " + i, "developer");
        }

        f.completion.complete(null, MissionCompletionHandler.COMPLETED);

        ArgumentCaptor<Lesson> lessons = ArgumentCaptor.forClass(Lesson.class);
        verify(f.lessons, times(3)).saveLesson(lessons.capture());
        assertTrue(lessons.getAllValues().stream().allMatch(l -> l.role().equals("developer")
                && l.type().equals("pattern")
                && l.lesson().startsWith("Successfully completed: Task ")));
    }

    @Test
    @DisplayName("stops every agent and commits the workspace")
    void stopsAgentsAndCommits() {
        AgentRuntime developer = f.agent("developer");
        AgentRuntime tester = f.agent("tester");
        when(f.git.autoCommit(anyString())).thenReturn(Optional.of("abc1234"));

        f.completion.complete(null, MissionCompletionHandler.STOPPED);

        assertEquals(AgentStatus.STOPPED, developer.getStatus());
        assertEquals(AgentStatus.STOPPED, tester.getStatus());
        assertFalse(f.bus.isSubscribed("developer"));
        verify(f.git).autoCommit("Mission ended: stopped");
        assertEquals("system", f.published(MessageType.MISSION_COMPLETE).get(0).sender());
        assertEquals("Mission ended: stopped", f.published(MessageType.MISSION_COMPLETE).get(0).content());
    }

    @Test
    @DisplayName("records the outcome metric")
    void metrics() {
        f.completion.complete(null, MissionCompletionHandler.BUDGET_EXHAUSTED);

        assertEquals(1.0, f.registry.find("hivemind.missions.total").tag("status", "budget_exhausted")
                .counter().count());
    }
}
