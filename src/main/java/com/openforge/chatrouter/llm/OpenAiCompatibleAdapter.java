package com.openforge.chatrouter.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.chatrouter.llm.model.ChatRequest;
import com.openforge.chatrouter.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Adapter for any provider exposing an OpenAI-style {@code /chat/completions}
 * endpoint (Groq, Cerebras, Mistral, OpenRouter, DeepSeek, OpenAI).
 *
 * Synchronous: the pool runs it on a worker thread and bounds it with a
 * time limiter, so no CompletableFuture is needed here.
 */
@Slf4j
public class OpenAiCompatibleAdapter extends HttpProviderAdapter {

    public OpenAiCompatibleAdapter(HttpClient httpClient,
                                   ObjectMapper objectMapper,
                                   LlmProperties.ProviderConfig config) {
        super(httpClient, objectMapper, config);
    }

    @Override
    public ProviderReply send(ProviderPrompt prompt, SendParams params) {
        long start = System.nanoTime();

        ChatRequest request = ChatRequest.builder()
                .model(config.model())
                .messages(prompt.messages())
                .temperature(params.temperature())
                .maxTokens(params.maxTokens())
                .build();
        String body = serialize(request);
        log.debug("[Provider:{}] → chat POST body-length={}", config.id(), body.length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        ChatResponse response = parse(requireSuccess(sendBlocking(httpRequest)), ChatResponse.class);
        String text = requireText(response.firstText());

        int tokens = response.usage() != null && response.usage().totalTokens() > 0
                ? response.usage().totalTokens()
                : estimateTokens(prompt, text);
        String model = response.model() != null ? response.model() : config.model();
        return new ProviderReply(text, tokens, elapsedMs(start), model);
    }
}
