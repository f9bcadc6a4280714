package com.hivemind.core.llm;

/**
 * How strictly an agent sticks to its pinned model.
 */
public enum PinPolicy {
    /** Wait for the pinned model's capacity; never route elsewhere. */
    WAIT,
    /** Prefer the pinned model, fall back to the role cascade when it is busy. */
    FALLBACK
}
