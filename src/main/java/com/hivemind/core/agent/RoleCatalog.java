package com.hivemind.core.agent;

import com.hivemind.core.security.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in roles merged with configured overrides.
 */
@Service
public class RoleCatalog {

    private static final Logger log = LoggerFactory.getLogger(RoleCatalog.class);

    public static final List<String> TEST_PATHS = List.of(
            "test_*", "**/test_*",
            "tests/**", "**/tests/**",
            "spec/**", "**/spec/**",
            "__tests__/**", "**/__tests__/**",
            "*_test.*", "**/*_test.*",
            "*.test.*", "**/*.test.*");

    static final List<RoleDescriptor> DEFAULT_ROLES = List.of(
            new RoleDescriptor("orchestrator", "Orchestrator", RolePrompts.ORCHESTRATOR,
                    EnumSet.allOf(Capability.class), List.of("**"), true, false, "orchestrator"),
            new RoleDescriptor("developer", "Developer", RolePrompts.DEVELOPER,
                    EnumSet.complementOf(EnumSet.of(Capability.PLAN, Capability.REVIEW)),
                    List.of("**"), false, true, "developer"),
            new RoleDescriptor("reviewer", "Reviewer", RolePrompts.REVIEWER,
                    EnumSet.of(Capability.READ_FILES, Capability.RUN_COMMANDS, Capability.UPDATE_TASKS,
                            Capability.REVIEW, Capability.COLLABORATE, Capability.RESERVE_FILES),
                    List.of(), false, true, "reviewer"),
            new RoleDescriptor("tester", "Tester", RolePrompts.TESTER,
                    EnumSet.of(Capability.READ_FILES, Capability.WRITE_FILES, Capability.RUN_COMMANDS,
                            Capability.UPDATE_TASKS, Capability.REVIEW, Capability.COLLABORATE,
                            Capability.RESERVE_FILES),
                    TEST_PATHS, false, true, "tester")
    );

    private final Map<String, RoleDescriptor> roles = new LinkedHashMap<>();
    private final List<String> roster;

    public RoleCatalog(RoleProperties properties) {
        for (RoleDescriptor role : DEFAULT_ROLES) {
            roles.put(role.name(), role);
        }
        properties.getDefinitions().forEach((name, override) -> {
            roles.put(name, merge(name, roles.get(name), override));
            log.info("Role '{}' configured", name);
        });
        this.roster = List.copyOf(properties.getRoster());
        for (String name : roster) {
            if (!roles.containsKey(name)) {
                throw new IllegalStateException("Roster names unknown role: " + name);
            }
        }
    }

    public Optional<RoleDescriptor> find(String name) {
        return Optional.ofNullable(roles.get(name));
    }

    public RoleDescriptor require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown role: " + name));
    }

    public List<RoleDescriptor> all() {
        return List.copyOf(roles.values());
    }

    /**
     * Roles started for a mission, planner first.
     */
    public List<RoleDescriptor> roster() {
        List<RoleDescriptor> result = new ArrayList<>();
        for (String name : roster) {
            result.add(roles.get(name));
        }
        result.sort((a, b) -> Boolean.compare(b.privileged(), a.privileged()));
        return result;
    }

    private static RoleDescriptor merge(String name, RoleDescriptor base, RoleProperties.Role override) {
        Set<Capability> capabilities = override.getCapabilities() != null
                ? (override.getCapabilities().isEmpty() ? Set.of() : EnumSet.copyOf(override.getCapabilities()))
                : base != null ? base.capabilities() : Set.of();
        return new RoleDescriptor(
                name,
                firstNonNull(override.getDisplayName(), base != null ? base.displayName() : null),
                firstNonNull(override.getPrompt(), base != null ? base.systemPrompt() : RolePrompts.ACTION_FORMAT),
                capabilities,
                firstNonNull(override.getWritablePaths(), base != null ? base.writablePaths() : List.of()),
                firstNonNull(override.getPrivileged(), base != null && base.privileged()),
                firstNonNull(override.getWaitsForTasks(), base == null || base.waitsForTasks()),
                firstNonNull(override.getCascadeRole(), base != null ? base.cascadeRole() : null));
    }

    private static <T> T firstNonNull(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
