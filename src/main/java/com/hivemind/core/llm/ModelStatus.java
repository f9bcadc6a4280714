package com.hivemind.core.llm;

import java.time.Duration;

/**
 * Read-only view of a model's routing state.
 */
public record ModelStatus(
        String name,
        String provider,
        String tier,
        boolean active,
        boolean hasCapacity,
        int requestsInWindow,
        int rpmLimit,
        boolean cooledDown,
        Duration cooldownRemaining,
        boolean authFailed,
        double costInPer1M,
        double costOutPer1M
) {
}
