package com.hivemind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    public ProviderRegistry providerRegistry(RouterProperties properties) {
        Map<String, LlmProvider> providers = new LinkedHashMap<>();
        properties.getProviders().forEach((name, settings) -> {
            if (!settings.hasApiKey()) {
                log.info("Provider '{}' has no API key, its models will not be routed", name);
                return;
            }
            providers.put(name, SpringAiChatProvider.create(name, settings));
        });
        if (providers.isEmpty()) {
            log.error("No LLM providers available. Set at least one provider API key.");
        }
        return new ProviderRegistry(providers);
    }
}
