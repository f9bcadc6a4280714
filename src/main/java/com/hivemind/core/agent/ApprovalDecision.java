package com.hivemind.core.agent;

import java.util.Locale;

/**
 * How an approval request ended. Only {@link #APPROVED} lets the action run.
 */
public enum ApprovalDecision {
    APPROVED,
    REJECTED,
    TIMED_OUT,
    CANCELLED;

    public boolean isApproved() {
        return this == APPROVED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
