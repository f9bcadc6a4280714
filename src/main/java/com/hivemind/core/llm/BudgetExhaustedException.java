package com.hivemind.core.llm;

/**
 * Raised before any provider call once estimated spend has reached the budget ceiling.
 */
public class BudgetExhaustedException extends RuntimeException {

    private final double limitUsd;
    private final double spentUsd;

    public BudgetExhaustedException(double limitUsd, double spentUsd) {
        super(String.format("Budget limit of $%.2f exceeded (spent $%.4f)", limitUsd, spentUsd));
        this.limitUsd = limitUsd;
        this.spentUsd = spentUsd;
    }

    public double getLimitUsd() {
        return limitUsd;
    }

    public double getSpentUsd() {
        return spentUsd;
    }
}
