package com.hivemind.core.model;

/**
 * Lifecycle state of a single agent loop.
 */
public enum AgentStatus {
    IDLE,
    THINKING,
    ACTING,
    WAITING,    // blocked on a human approval
    PAUSED,
    STOPPED
}
