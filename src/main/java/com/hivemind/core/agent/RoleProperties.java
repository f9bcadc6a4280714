package com.hivemind.core.agent;

import com.hivemind.core.security.Capability;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Role overrides and additions, bound from {@code hivemind.roles}. Unset
 * fields of an override keep the built-in role's value.
 */
@Component
@ConfigurationProperties(prefix = "hivemind.roles")
public class RoleProperties {

    /** Roles started for each mission, in start order. */
    private List<String> roster = new ArrayList<>(List.of("orchestrator", "developer", "reviewer", "tester"));

    private Map<String, Role> definitions = new LinkedHashMap<>();

    public List<String> getRoster() {
        return roster;
    }

    public void setRoster(List<String> roster) {
        this.roster = roster;
    }

    public Map<String, Role> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(Map<String, Role> definitions) {
        this.definitions = definitions;
    }

    public static class Role {
        private String displayName;
        private String prompt;
        private List<Capability> capabilities;
        private List<String> writablePaths;
        private Boolean privileged;
        private Boolean waitsForTasks;
        private String cascadeRole;

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public String getPrompt() {
            return prompt;
        }

        public void setPrompt(String prompt) {
            this.prompt = prompt;
        }

        public List<Capability> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(List<Capability> capabilities) {
            this.capabilities = capabilities;
        }

        public List<String> getWritablePaths() {
            return writablePaths;
        }

        public void setWritablePaths(List<String> writablePaths) {
            this.writablePaths = writablePaths;
        }

        public Boolean getPrivileged() {
            return privileged;
        }

        public void setPrivileged(Boolean privileged) {
            this.privileged = privileged;
        }

        public Boolean getWaitsForTasks() {
            return waitsForTasks;
        }

        public void setWaitsForTasks(Boolean waitsForTasks) {
            this.waitsForTasks = waitsForTasks;
        }

        public String getCascadeRole() {
            return cascadeRole;
        }

        public void setCascadeRole(String cascadeRole) {
            this.cascadeRole = cascadeRole;
        }
    }
}
