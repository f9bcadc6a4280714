package com.hivemind.core.bus;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Kinds of messages exchanged on the bus.
 */
public enum MessageType {
    CHAT,
    CODE_UPDATE,
    TASK_ASSIGNED,
    REVIEW_REQUEST,
    REVIEW_RESULT,
    TEST_RESULT,
    APPROVAL_REQUEST,
    APPROVAL_RESPONSE,
    TERMINAL_OUTPUT,
    FILE_UPDATE,
    SYSTEM,
    AGENT_STATUS,
    THOUGHT,
    HANDOFF,
    ASK_HELP,
    SHARE_INSIGHT,
    PROPOSE_APPROACH,
    MISSION_COMPLETE;

    /** Types delivered to every mailbox even when the message carries mentions. */
    public static final Set<MessageType> BROADCAST = EnumSet.of(SYSTEM, AGENT_STATUS, TASK_ASSIGNED);

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBroadcast() {
        return BROADCAST.contains(this);
    }
}
