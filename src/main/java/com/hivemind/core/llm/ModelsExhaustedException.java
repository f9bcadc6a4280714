package com.hivemind.core.llm;

/**
 * Every attempt allowed for one generation failed.
 */
public class ModelsExhaustedException extends RuntimeException {

    private final int attempts;

    public ModelsExhaustedException(int attempts, Throwable lastError) {
        super("Failed after " + attempts + " attempts across all models"
                + (lastError != null ? ": " + lastError.getMessage() : ""), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
