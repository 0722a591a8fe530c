package com.openforge.chatrouter.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;

/** Builds the adapter variant matching a provider's {@link ProviderType}. */
@Component
@RequiredArgsConstructor
public class ProviderAdapterFactory {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;

    public ProviderAdapter create(LlmProperties.ProviderConfig config) {
        return switch (config.type()) {
            case OPENAI -> new OpenAiCompatibleAdapter(httpClient, objectMapper, config);
            case GEMINI -> new GeminiAdapter(httpClient, objectMapper, config);
        };
    }
}
