package com.hivemind.core.llm;

public record ProviderResponse(String text, long inputTokens, long outputTokens) {

    public ProviderResponse {
        text = text == null ? "" : text;
    }
}
