package com.hivemind.core.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-task failure streaks for one agent. A streak drives the self-reflection prompt;
 * an A-B-A error pattern marks the agent as oscillating between two broken fixes.
 * The reflection prompt is delivered once per streak.
 */
public class TaskFailureTracker {

    private final Map<String, List<String>> errorHistory = new ConcurrentHashMap<>();
    private final Set<String> reflected = ConcurrentHashMap.newKeySet();

    public void recordFailure(String taskId, String errorMessage) {
        errorHistory.computeIfAbsent(taskId, k -> new ArrayList<>()).add(errorMessage);
    }

    /**
     * Ends the streak for a task after a successful action.
     */
    public void reset(String taskId) {
        errorHistory.remove(taskId);
        reflected.remove(taskId);
    }

    public void markReflected(String taskId) {
        reflected.add(taskId);
    }

    public boolean isReflected(String taskId) {
        return reflected.contains(taskId);
    }

    public int failureCount(String taskId) {
        var history = errorHistory.get(taskId);
        return history != null ? history.size() : 0;
    }

    public String lastError(String taskId) {
        var history = errorHistory.get(taskId);
        return history == null || history.isEmpty() ? "unknown error" : history.get(history.size() - 1);
    }

    public boolean isOscillating(String taskId) {
        var history = errorHistory.get(taskId);
        if (history == null || history.size() < 3) {
            return false;
        }
        // error[N] matches error[N-2] but differs from error[N-1]
        for (int i = 2; i < history.size(); i++) {
            String current = history.get(i);
            String twoBack = history.get(i - 2);
            String oneBack = history.get(i - 1);
            if (current.equals(twoBack) && !current.equals(oneBack)) {
                return true;
            }
        }
        return false;
    }
}
