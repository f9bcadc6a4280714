package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a finished (or aborted) mission, written to the mission history.
 *
 * @param id              mission identifier (e.g. "HVMD-2026-0001")
 * @param goal            the natural-language goal the swarm worked on
 * @param workspace       absolute workspace root
 * @param tasks           final state of every task
 * @param costUsd         estimated model spend
 * @param durationSeconds wall-clock duration
 * @param agents          ids of the agents that took part
 * @param status          "completed", "budget_exhausted", "stopped", ...
 * @param timestamp       when the record was written
 */
public record MissionRecord(
    String id,
    String goal,
    String workspace,
    List<Task> tasks,
    double costUsd,
    double durationSeconds,
    List<String> agents,
    String status,
    Instant timestamp
) implements Serializable {

    public MissionRecord {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        agents = agents == null ? List.of() : List.copyOf(agents);
    }
}
