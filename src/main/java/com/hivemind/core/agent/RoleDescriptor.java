package com.hivemind.core.agent;

import com.hivemind.core.security.Capability;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Everything that distinguishes one kind of agent from another. A single
 * {@link AgentRuntime} implementation is parameterized by one of these.
 *
 * @param name          role name, also the default agent id ("developer")
 * @param displayName   human-readable name used in prompts and the CLI
 * @param systemPrompt  role prompt; the runtime appends task board and lessons
 * @param capabilities  actions the role may take
 * @param writablePaths glob patterns the role may write, edit or delete
 * @param privileged    the planner: bypasses the task gate and may finish the mission
 * @param waitsForTasks stays idle until it has assigned work or an addressed message
 * @param cascadeRole   router cascade used for this role's requests
 */
public record RoleDescriptor(
    String name,
    String displayName,
    String systemPrompt,
    Set<Capability> capabilities,
    List<String> writablePaths,
    boolean privileged,
    boolean waitsForTasks,
    String cascadeRole
) {

    public RoleDescriptor {
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
        writablePaths = writablePaths == null ? List.of() : List.copyOf(writablePaths);
        displayName = displayName == null || displayName.isBlank() ? name : displayName;
        cascadeRole = cascadeRole == null || cascadeRole.isBlank() ? name : cascadeRole;
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
    }

    public boolean can(Capability capability) {
        return capabilities.contains(capability);
    }
}
