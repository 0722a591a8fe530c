package com.openforge.chatrouter.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.chatrouter.llm.model.GeminiRequest;
import com.openforge.chatrouter.llm.model.GeminiResponse;
import com.openforge.chatrouter.llm.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Adapter for Google Gemini's native {@code generateContent} API.
 *
 * Role mapping: system messages become {@code systemInstruction},
 * "assistant" becomes "model".  Gemini rejects two consecutive turns with the
 * same role, so adjacent turns of one role are merged.
 */
@Slf4j
public class GeminiAdapter extends HttpProviderAdapter {

    public GeminiAdapter(HttpClient httpClient,
                         ObjectMapper objectMapper,
                         LlmProperties.ProviderConfig config) {
        super(httpClient, objectMapper, config);
    }

    @Override
    public ProviderReply send(ProviderPrompt prompt, SendParams params) {
        long start = System.nanoTime();

        String system = prompt.systemText();
        GeminiRequest request = new GeminiRequest(
                contents(prompt.conversation()),
                system == null ? null : GeminiRequest.Content.of(null, system),
                new GeminiRequest.GenerationConfig(params.temperature(), params.maxTokens()));
        String body = serialize(request);
        log.debug("[Provider:{}] → generateContent POST body-length={}", config.id(), body.length());

        String url = "%s/models/%s:generateContent?key=%s".formatted(
                config.baseUrl(), config.model(),
                URLEncoder.encode(config.apiKey() == null ? "" : config.apiKey(), StandardCharsets.UTF_8));
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        GeminiResponse response = parse(requireSuccess(sendBlocking(httpRequest)), GeminiResponse.class);
        String text = requireText(response.firstText());

        int tokens = response.usageMetadata() != null && response.usageMetadata().totalTokenCount() > 0
                ? response.usageMetadata().totalTokenCount()
                : estimateTokens(prompt, text);
        String model = response.modelVersion() != null ? response.modelVersion() : config.model();
        return new ProviderReply(text, tokens, elapsedMs(start), model);
    }

    static List<GeminiRequest.Content> contents(List<Message> conversation) {
        List<GeminiRequest.Content> contents = new ArrayList<>();
        String        role   = null;
        StringBuilder buffer = new StringBuilder();
        for (Message m : conversation) {
            String mapped = Message.ASSISTANT.equals(m.role()) ? "model" : "user";
            if (role != null && !role.equals(mapped)) {
                contents.add(GeminiRequest.Content.of(role, buffer.toString()));
                buffer.setLength(0);
            }
            if (buffer.length() > 0) buffer.append("\n\n");
            buffer.append(m.content());
            role = mapped;
        }
        if (role != null) {
            contents.add(GeminiRequest.Content.of(role, buffer.toString()));
        }
        return contents;
    }
}
