package com.hivemind.core.llm;

/**
 * A chat-completion backend. Implementations translate transport failures into
 * {@link ProviderException} so the router can classify them.
 */
public interface LlmProvider {

    String name();

    ProviderResponse generate(GenerationRequest request);
}
