package com.hivemind.core.action;

import com.hivemind.core.security.Capability;

import java.util.Locale;

/**
 * The closed set of actions an agent may ask for. Anything else parses to {@link #UNKNOWN}.
 */
public enum ActionKind {
    READ_FILE(Capability.READ_FILES),
    WRITE_FILE(Capability.WRITE_FILES),
    EDIT_FILE(Capability.WRITE_FILES),
    LIST_FILES(Capability.READ_FILES),
    DELETE_FILE(Capability.DELETE_FILES),
    RUN_COMMAND(Capability.RUN_COMMANDS),
    CREATE_TASK(Capability.PLAN),
    CREATE_TASKS(Capability.PLAN),
    UPDATE_TASK(Capability.UPDATE_TASKS),
    REVIEW_TASK(Capability.REVIEW),
    FINALIZE_PLAN(Capability.PLAN),
    SUGGEST_TASK(Capability.COLLABORATE),
    REQUEST_REVIEW(Capability.COLLABORATE),
    HANDOFF(Capability.COLLABORATE),
    ESCALATE_TASK(Capability.UPDATE_TASKS),
    RESERVE_FILE(Capability.RESERVE_FILES),
    RELEASE_FILE(Capability.RESERVE_FILES),
    ASK_HELP(Capability.COLLABORATE),
    SHARE_INSIGHT(Capability.COLLABORATE),
    PROPOSE_APPROACH(Capability.COLLABORATE),
    MESSAGE(Capability.COLLABORATE),
    DONE(Capability.PLAN),
    UNKNOWN(null);

    private final Capability requires;

    ActionKind(Capability requires) {
        this.requires = requires;
    }

    /**
     * Capability a role needs to perform this action, or {@code null} for {@link #UNKNOWN}.
     */
    public Capability requires() {
        return requires;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Actions whose outcome feeds the per-task failure counter. */
    public boolean isTracked() {
        return this == WRITE_FILE || this == EDIT_FILE || this == RUN_COMMAND;
    }

    public static ActionKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MESSAGE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
