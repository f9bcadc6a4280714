package com.hivemind.core.security;

import com.hivemind.core.action.ActionKind;
import com.hivemind.core.action.AgentAction;
import com.hivemind.core.agent.RoleDescriptor;
import org.springframework.stereotype.Service;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a role may take an action. The same check applies to every role;
 * roles differ only in their capabilities and writable paths.
 */
@Service
public class ActionAuthorizer {

    private static final Set<ActionKind> PATH_CHECKED = Set.of(
            ActionKind.WRITE_FILE, ActionKind.EDIT_FILE, ActionKind.DELETE_FILE);

    /**
     * @return a denial reason, or empty when the action is allowed
     */
    public Optional<String> authorize(RoleDescriptor role, AgentAction action) {
        Capability required = action.kind().requires();
        if (required != null && !role.can(required)) {
            return Optional.of("Role '" + role.name() + "' is not allowed to " + action.kind().wireName());
        }
        if (PATH_CHECKED.contains(action.kind())) {
            String path = action.params().path();
            if (path == null || path.isBlank()) {
                return Optional.of(action.kind().wireName() + " requires a path");
            }
            if (!isPathWritable(role, path)) {
                return Optional.of("Role '" + role.name() + "' may not modify " + path);
            }
        }
        return Optional.empty();
    }

    public boolean isPathWritable(RoleDescriptor role, String relativePath) {
        String normalized = relativePath.startsWith("./") ? relativePath.substring(2) : relativePath;
        return matchesAny(role.writablePaths(), normalized);
    }

    private boolean matchesAny(List<String> globs, String relativePath) {
        if (globs == null || globs.isEmpty()) {
            return false;
        }
        Path path;
        try {
            path = Paths.get(relativePath);
        } catch (InvalidPathException e) {
            return false;
        }
        for (String glob : globs) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }
}
