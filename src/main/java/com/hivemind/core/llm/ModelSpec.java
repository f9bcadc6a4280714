package com.hivemind.core.llm;

/**
 * Static description of a routable model.
 *
 * @param name          model id sent to the provider
 * @param provider      key into the provider registry ("gemini", "groq", ...)
 * @param rpm           requests allowed in any trailing 60 s window
 * @param costInPer1M   USD per million input tokens
 * @param costOutPer1M  USD per million output tokens
 * @param tier          free-form label shown in status views
 */
public record ModelSpec(
        String name,
        String provider,
        int rpm,
        double costInPer1M,
        double costOutPer1M,
        String tier
) {

    public double costFor(long inputTokens, long outputTokens) {
        return inputTokens / 1_000_000.0 * costInPer1M + outputTokens / 1_000_000.0 * costOutPer1M;
    }

    public String priceDisplay() {
        if (costInPer1M == 0 && costOutPer1M == 0) {
            return "free";
        }
        return String.format("$%.2f / $%.2f per 1M tokens", costInPer1M, costOutPer1M);
    }
}
