package com.hivemind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.retry.support.RetryTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link LlmProvider} backed by Spring AI's {@link ChatClient} over an OpenAI-compatible endpoint
 * (Groq, Gemini's OpenAI surface, OpenAI itself).
 * <p>
 * Spring AI's own retry is disabled: the router owns retries, cooldowns and failover.
 */
public class SpringAiChatProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiChatProvider.class);

    private static final ResponseFormat JSON_OBJECT = ResponseFormat.builder()
            .type(ResponseFormat.Type.JSON_OBJECT)
            .build();

    private final String name;
    private final ChatClient chatClient;

    public SpringAiChatProvider(String name, ChatClient chatClient) {
        this.name = name;
        this.chatClient = chatClient;
    }

    /**
     * Builds a provider for one configured endpoint.
     */
    public static SpringAiChatProvider create(String name, RouterProperties.Provider settings) {
        OpenAiApi openAiApi = OpenAiApi.builder()
                .baseUrl(settings.getBaseUrl())
                .completionsPath(settings.getCompletionsPath())
                .apiKey(settings.getApiKey())
                .build();
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(OpenAiChatOptions.builder().build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
        log.info("LLM provider '{}' initialized, base-url: {}", name, settings.getBaseUrl());
        return new SpringAiChatProvider(name, ChatClient.builder(chatModel).build());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderResponse generate(GenerationRequest request) {
        List<Message> history = new ArrayList<>();
        for (ChatTurn turn : request.messages()) {
            history.add(turn.role() == ChatTurn.Role.ASSISTANT
                    ? new AssistantMessage(turn.content())
                    : new UserMessage(turn.content()));
        }
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .model(request.model())
                .temperature(request.temperature());
        if (request.structuredOutput()) {
            options.responseFormat(JSON_OBJECT);
        }

        ChatResponse response;
        try {
            response = chatClient.prompt()
                    .system(request.systemPrompt())
                    .messages(history)
                    .options(options.build())
                    .call()
                    .chatResponse();
        } catch (RuntimeException e) {
            throw ProviderException.from(e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ProviderException(ProviderException.Kind.OTHER,
                    name + " returned no output for " + request.model());
        }
        String text = response.getResult().getOutput().getText();
        long inputTokens = 0;
        long outputTokens = 0;
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage != null) {
            inputTokens = toLong(usage.getPromptTokens());
            outputTokens = toLong(usage.getCompletionTokens());
        }
        return new ProviderResponse(text, inputTokens, outputTokens);
    }

    private static long toLong(Number value) {
        return value == null ? 0 : value.longValue();
    }
}
