package com.hivemind.core.llm;

/**
 * Snapshot of spend against the configured ceiling. A limit of zero or less means unlimited.
 */
public record BudgetStatus(
        double limitUsd,
        double spentUsd,
        double remainingUsd,
        double percentUsed,
        boolean exceeded,
        boolean warning
) {
}
