package com.hivemind.core.agent;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.scheduler.TaskGraph;
import com.hivemind.core.scheduler.TaskProperties;
import com.hivemind.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private final RoleCatalog roles = new RoleCatalog(new RoleProperties());
    private final TaskGraph tasks = new TaskGraph(new TaskProperties(), new MutableClock());

    @Test
    @DisplayName("worker prompt lists assigned tasks with status and description")
    void workerTasks() {
        Task task = tasks.createTask("Add login form", "Render a form with email and password", "orchestrator",
                "developer", List.of(), List.of(), TaskPriority.HIGH, true, false);

        String prompt = PromptBuilder.build(roles.require("developer"), "developer", List.of(task), List.of(),
                true, "", "");

        assertTrue(prompt.startsWith(RolePrompts.DEVELOPER));
        assertTrue(prompt.contains("## Your Tasks"));
        assertTrue(prompt.contains(task.label() + " (todo)"));
        assertTrue(prompt.contains("Render a form with email and password"));
        assertFalse(prompt.contains("## Planning Status"));
    }

    @Test
    @DisplayName("worker without tasks is told so")
    void noTasks() {
        String prompt = PromptBuilder.build(roles.require("tester"), "tester", List.of(), List.of(), true, "", "");

        assertTrue(prompt.contains("No tasks assigned to you yet."));
    }

    @Test
    @DisplayName("planner prompt shows planning status instead of a task list")
    void plannerStatus() {
        RoleDescriptor orchestrator = roles.require("orchestrator");

        String planning = PromptBuilder.build(orchestrator, "orchestrator", List.of(), List.of(), false, "", "");
        String finalized = PromptBuilder.build(orchestrator, "orchestrator", List.of(), List.of(), true, "", "");

        assertTrue(planning.contains("## Planning Status\nPLANNING"));
        assertTrue(finalized.contains("Plan finalized"));
        assertFalse(planning.contains("## Your Tasks"));
    }

    @Test
    @DisplayName("handoffs, lessons and the codebase summary are appended")
    void sections() {
        Task task = tasks.createTask("Fix parser", "", "orchestrator");
        Task handedOff = tasks.setHandoff(task.id(), "reviewer", "ready for a look");

        String prompt = PromptBuilder.build(roles.require("reviewer"), "reviewer", List.of(), List.of(handedOff),
                true, "# Existing Codebase Analysis", "## Lessons from Previous Missions\n- [pattern] test first");

        assertTrue(prompt.contains("## Handoffs For You\n- " + task.label() + ": ready for a look"));
        assertTrue(prompt.contains("- [pattern] test first"));
        assertTrue(prompt.endsWith("## Current Codebase\n# Existing Codebase Analysis"));
    }

    @Test
    @DisplayName("long descriptions are cut")
    void longDescription() {
        Task task = tasks.createTask("Big", "y".repeat(1000), "orchestrator", "developer", List.of(), List.of(),
                TaskPriority.MEDIUM, true, false);

        String prompt = PromptBuilder.build(roles.require("developer"), "developer", List.of(task), List.of(),
                true, "", "");

        assertTrue(prompt.contains("y".repeat(300) + "..."));
        assertFalse(prompt.contains("y".repeat(301)));
    }
}
