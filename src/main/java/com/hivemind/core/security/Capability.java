package com.hivemind.core.security;

/**
 * Coarse permissions granted to a role. Every action kind requires exactly one.
 */
public enum Capability {
    READ_FILES,
    WRITE_FILES,
    DELETE_FILES,
    RUN_COMMANDS,
    /** Create tasks, finalize the plan, complete the mission. */
    PLAN,
    UPDATE_TASKS,
    REVIEW,
    RESERVE_FILES,
    COLLABORATE
}
