package com.hivemind.core.llm;

/**
 * Accumulated token counts and estimated spend.
 */
public record TokenUsage(long inputTokens, long outputTokens, double costUsd) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0.0);

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public TokenUsage add(long input, long output, double cost) {
        return new TokenUsage(inputTokens + input, outputTokens + output, costUsd + cost);
    }
}
