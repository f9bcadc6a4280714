package com.hivemind.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Mocks the {@link ChatClient} fluent chain so no real LLM calls are made.
 */
class SpringAiChatProviderTest {

    private ChatClientRequestSpec requestSpec;
    private CallResponseSpec callResponse;
    private SpringAiChatProvider provider;

    @BeforeEach
    void setUp() {
        ChatClient chatClient = mock(ChatClient.class);
        requestSpec = mock(ChatClientRequestSpec.class);
        callResponse = mock(CallResponseSpec.class);

        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.system(anyString())).thenReturn(requestSpec);
        when(requestSpec.messages(anyList())).thenReturn(requestSpec);
        when(requestSpec.options(any())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callResponse);

        provider = new SpringAiChatProvider("groq", chatClient);
    }

    private static ChatResponse response(String text, int in, int out) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))),
                ChatResponseMetadata.builder().usage(new DefaultUsage(in, out)).build());
    }

    private static GenerationRequest request(boolean structured) {
        return new GenerationRequest("llama-3.3-70b-versatile", "You are a developer.",
                List.of(ChatTurn.user("task assigned"), ChatTurn.assistant("{\"action\":\"message\"}")),
                0.7, structured);
    }

    @Test
    @DisplayName("sends system prompt, history and model options through the ChatClient chain")
    @SuppressWarnings("unchecked")
    void sendsPrompt() {
        when(callResponse.chatResponse()).thenReturn(response("{}", 12, 7));

        provider.generate(request(true));

        verify(requestSpec).system("You are a developer.");
        ArgumentCaptor<List<Message>> history = ArgumentCaptor.forClass(List.class);
        verify(requestSpec).messages(history.capture());
        assertInstanceOf(UserMessage.class, history.getValue().get(0));
        assertInstanceOf(AssistantMessage.class, history.getValue().get(1));

        ArgumentCaptor<OpenAiChatOptions> options = ArgumentCaptor.forClass(OpenAiChatOptions.class);
        verify(requestSpec).options(options.capture());
        assertEquals("llama-3.3-70b-versatile", options.getValue().getModel());
        assertEquals(ResponseFormat.Type.JSON_OBJECT, options.getValue().getResponseFormat().getType());
    }

    @Test
    @DisplayName("omits JSON mode when structured output is off")
    void noJsonMode() {
        when(callResponse.chatResponse()).thenReturn(response("plain", 1, 1));

        provider.generate(request(false));

        ArgumentCaptor<OpenAiChatOptions> options = ArgumentCaptor.forClass(OpenAiChatOptions.class);
        verify(requestSpec).options(options.capture());
        assertNull(options.getValue().getResponseFormat());
    }

    @Test
    @DisplayName("returns text and token usage")
    void returnsUsage() {
        when(callResponse.chatResponse()).thenReturn(response("{\"action\":\"done\"}", 120, 30));

        ProviderResponse result = provider.generate(request(true));

        assertEquals("{\"action\":\"done\"}", result.text());
        assertEquals(120, result.inputTokens());
        assertEquals(30, result.outputTokens());
    }

    @Test
    @DisplayName("transport failures surface as classified ProviderExceptions")
    void classifiesFailures() {
        when(requestSpec.call()).thenThrow(new RuntimeException("HTTP 429 - rate_limit_exceeded"));

        ProviderException e = assertThrows(ProviderException.class, () -> provider.generate(request(true)));

        assertEquals(ProviderException.Kind.RATE_LIMITED, e.kind());
    }

    @Test
    @DisplayName("a response without output is an error")
    void emptyResponse() {
        when(callResponse.chatResponse()).thenReturn(null);

        ProviderException e = assertThrows(ProviderException.class, () -> provider.generate(request(true)));

        assertEquals(ProviderException.Kind.OTHER, e.kind());
    }
}
