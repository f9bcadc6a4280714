package com.hivemind.core.llm;

/**
 * No usable provider remains: none is configured, or every registered model failed authentication.
 */
public class ProvidersExhaustedException extends RuntimeException {
    public ProvidersExhaustedException(String message) {
        super(message);
    }
}
