package com.hivemind.core.workspace;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tracks which agents recently touched which files, for conflict warnings and the
 * planner's activity overview. Touches older than the activity window are pruned.
 */
public class FileTracker {

    private final List<FileTouch> touches = new ArrayList<>();
    private final Duration activityWindow;
    private final Clock clock;

    public FileTracker(Duration activityWindow, Clock clock) {
        this.activityWindow = activityWindow;
        this.clock = clock;
    }

    /**
     * A file modified by more than one agent within the activity window.
     */
    public record Conflict(String path, List<String> agents) {
    }

    public synchronized void record(String agentId, String path, FileTouch.Action action) {
        touches.add(new FileTouch(agentId, path, action, clock.instant()));
        prune();
    }

    /**
     * Agents that touched the path recently, in first-touch order.
     */
    public synchronized List<String> recentAgents(String path, String exclude) {
        prune();
        Set<String> agents = new LinkedHashSet<>();
        for (FileTouch t : touches) {
            if (t.path().equals(path) && !t.agentId().equals(exclude)) {
                agents.add(t.agentId());
            }
        }
        return List.copyOf(agents);
    }

    public synchronized List<String> recentWriters(String path, String exclude) {
        prune();
        Set<String> agents = new LinkedHashSet<>();
        for (FileTouch t : touches) {
            if (t.path().equals(path) && t.action().isMutation() && !t.agentId().equals(exclude)) {
                agents.add(t.agentId());
            }
        }
        return List.copyOf(agents);
    }

    public synchronized List<String> agentFiles(String agentId) {
        prune();
        Set<String> files = new LinkedHashSet<>();
        for (FileTouch t : touches) {
            if (t.agentId().equals(agentId)) {
                files.add(t.path());
            }
        }
        return List.copyOf(files);
    }

    public synchronized List<Conflict> conflicts() {
        prune();
        Map<String, Set<String>> writers = writersByPath();
        List<Conflict> conflicts = new ArrayList<>();
        writers.forEach((path, agents) -> {
            if (agents.size() > 1) {
                conflicts.add(new Conflict(path, List.copyOf(agents)));
            }
        });
        return conflicts;
    }

    /**
     * Human-readable summary of recent write activity, with a conflict section when
     * several agents modified the same file.
     */
    public synchronized String activitySummary() {
        prune();
        if (touches.isEmpty()) {
            return "No recent file activity.";
        }

        Map<String, Set<String>> byAgent = new TreeMap<>();
        for (FileTouch t : touches) {
            if (t.action().isMutation()) {
                byAgent.computeIfAbsent(t.agentId(), k -> new TreeSet<>()).add(t.path());
            }
        }
        if (byAgent.isEmpty()) {
            return "No recent write activity.";
        }

        StringBuilder sb = new StringBuilder();
        byAgent.forEach((agent, files) ->
                sb.append("- ").append(agent).append(" modified: ").append(String.join(", ", files)).append('\n'));

        List<Conflict> conflicts = conflicts();
        if (!conflicts.isEmpty()) {
            sb.append("\nFILE CONFLICTS (multiple agents editing the same file):\n");
            for (Conflict c : conflicts) {
                sb.append("- ").append(c.path()).append(" edited by: ")
                        .append(String.join(", ", c.agents())).append('\n');
            }
        }
        return sb.toString().stripTrailing();
    }

    private Map<String, Set<String>> writersByPath() {
        Map<String, Set<String>> writers = new TreeMap<>();
        for (FileTouch t : touches) {
            if (t.action().isMutation()) {
                writers.computeIfAbsent(t.path(), k -> new TreeSet<>()).add(t.agentId());
            }
        }
        return writers;
    }

    private void prune() {
        Instant cutoff = clock.instant().minus(activityWindow);
        touches.removeIf(t -> !t.timestamp().isAfter(cutoff));
    }
}
