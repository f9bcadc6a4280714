package com.hivemind.core.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Providers that have credentials, keyed by provider name.
 */
public class ProviderRegistry {

    private final Map<String, LlmProvider> providers;

    public ProviderRegistry(Map<String, LlmProvider> providers) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    public Optional<LlmProvider> get(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public boolean contains(String name) {
        return providers.containsKey(name);
    }

    public Set<String> names() {
        return providers.keySet();
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }
}
