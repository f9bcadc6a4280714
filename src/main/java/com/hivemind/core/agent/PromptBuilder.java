package com.hivemind.core.agent;

import com.hivemind.core.model.Task;

import java.util.List;

/**
 * Assembles an agent's system prompt from its role prompt and the current task board.
 * Pure function, no Spring dependencies.
 */
public final class PromptBuilder {

    private static final int MAX_DESCRIPTION = 300;

    private PromptBuilder() {}

    public static String build(RoleDescriptor role, String agentId, List<Task> assigned, List<Task> handoffs,
                               boolean planningComplete, String codebaseSummary, String lessons) {
        var sb = new StringBuilder(role.systemPrompt());

        sb.append("\n\n## Identity\n");
        sb.append("You are `").append(agentId).append("` (").append(role.displayName()).append(").\n");

        if (role.privileged()) {
            sb.append("\n## Planning Status\n");
            sb.append(planningComplete
                    ? "Plan finalized: monitor and coordinate.\n"
                    : "PLANNING: create all tasks now, then call finalize_plan.\n");
        } else {
            sb.append("\n## Your Tasks\n");
            if (assigned.isEmpty()) {
                sb.append("No tasks assigned to you yet.\n");
            }
            for (Task task : assigned) {
                sb.append("- ").append(task.label())
                  .append(" (").append(task.status().wireName()).append(")");
                if (!task.dependencies().isEmpty()) {
                    sb.append(" depends on ").append(task.dependencies());
                }
                sb.append('\n');
                if (!task.description().isBlank()) {
                    sb.append("  ").append(abbreviate(task.description())).append('\n');
                }
            }
        }

        if (!handoffs.isEmpty()) {
            sb.append("\n## Handoffs For You\n");
            for (Task task : handoffs) {
                sb.append("- ").append(task.label());
                if (task.handoffReason() != null && !task.handoffReason().isBlank()) {
                    sb.append(": ").append(task.handoffReason());
                }
                sb.append('\n');
            }
        }

        if (lessons != null && !lessons.isBlank()) {
            sb.append('\n').append(lessons).append('\n');
        }

        if (codebaseSummary != null && !codebaseSummary.isBlank()) {
            sb.append("\n## Current Codebase\n").append(codebaseSummary);
        }
        return sb.toString();
    }

    private static String abbreviate(String text) {
        String oneLine = text.replace('\n', ' ');
        return oneLine.length() <= MAX_DESCRIPTION ? oneLine : oneLine.substring(0, MAX_DESCRIPTION) + "...";
    }
}
