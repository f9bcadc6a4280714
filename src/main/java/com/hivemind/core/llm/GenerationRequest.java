package com.hivemind.core.llm;

import java.util.List;

/**
 * A single provider call.
 *
 * @param structuredOutput ask the provider for JSON-object output mode
 */
public record GenerationRequest(
        String model,
        String systemPrompt,
        List<ChatTurn> messages,
        double temperature,
        boolean structuredOutput
) {

    public GenerationRequest {
        messages = List.copyOf(messages);
    }

    public GenerationRequest withoutStructuredOutput() {
        return new GenerationRequest(model, systemPrompt, messages, temperature, false);
    }
}
