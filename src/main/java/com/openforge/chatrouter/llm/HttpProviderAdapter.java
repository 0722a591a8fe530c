package com.openforge.chatrouter.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;

/**
 * Shared plumbing for HTTP/JSON providers: blocking send, status mapping and
 * (de)serialization.  Subclasses only build the wire request and read the
 * wire response.
 */
@Slf4j
public abstract class HttpProviderAdapter implements ProviderAdapter {

    protected static final int CHARS_PER_TOKEN = 4;

    private static final int MAX_BODY_IN_MESSAGE = 512;

    protected final HttpClient                   httpClient;
    protected final ObjectMapper                 objectMapper;
    protected final LlmProperties.ProviderConfig config;

    protected HttpProviderAdapter(HttpClient httpClient,
                                  ObjectMapper objectMapper,
                                  LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    @Override
    public String providerId() {
        return config.id();
    }

    @Override
    public String model() {
        return config.model();
    }

    // ── Helpers for subclasses ───────────────────────────────────────────────

    protected HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(config.id(), FailureKind.TRANSIENT_ERROR,
                    "Timed out calling provider [%s]".formatted(config.id()), e);
        } catch (IOException e) {
            throw new ProviderException(config.id(), FailureKind.TRANSIENT_ERROR,
                    "Network error calling provider [%s]: %s".formatted(config.id(), e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(config.id(), FailureKind.TRANSIENT_ERROR,
                    "Interrupted while calling provider [%s]".formatted(config.id()), e);
        }
    }

    /**
     * Returns the body of a 2xx response, otherwise throws a
     * {@link ProviderException} categorised by status code.
     */
    protected String requireSuccess(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[Provider:{}] ← HTTP {} body-length={}", config.id(), status,
                body == null ? 0 : body.length());

        if (status >= 200 && status < 300) {
            return body;
        }
        throw new ProviderException(config.id(), kindForStatus(status),
                "Provider [%s] returned HTTP %d: %s".formatted(config.id(), status, abbreviate(body)));
    }

    static FailureKind kindForStatus(int status) {
        if (status == 429)                       return FailureKind.RATE_LIMITED;
        if (status == 401 || status == 403)     return FailureKind.AUTH_ERROR;
        if (status == 408 || status >= 500)     return FailureKind.TRANSIENT_ERROR;
        return FailureKind.INVALID_RESPONSE;
    }

    protected <T> T parse(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ProviderException(config.id(), FailureKind.INVALID_RESPONSE,
                    "Failed to parse response from provider [%s]: %s".formatted(config.id(), abbreviate(body)), e);
        }
    }

    protected String serialize(Object request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ProviderException(config.id(), FailureKind.INVALID_RESPONSE,
                    "Failed to serialize request for provider [%s]".formatted(config.id()), e);
        }
    }

    protected String requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new ProviderException(config.id(), FailureKind.INVALID_RESPONSE,
                    "Provider [%s] returned no text".formatted(config.id()));
        }
        return text;
    }

    protected static int estimateTokens(ProviderPrompt prompt, String reply) {
        return (prompt.characterCount() + reply.length()) / CHARS_PER_TOKEN;
    }

    protected static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > MAX_BODY_IN_MESSAGE ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..." : body;
    }
}
