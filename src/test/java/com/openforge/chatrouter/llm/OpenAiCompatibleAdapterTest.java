package com.openforge.chatrouter.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.openforge.chatrouter.llm.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAiCompatibleAdapterTest {

    private static final ProviderPrompt PROMPT = ProviderPrompt.of(
            Message.system("You are helpful."), Message.user("Hi there"));
    private static final SendParams PARAMS = new SendParams(0.7, 256);

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private OpenAiCompatibleAdapter adapter;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        LlmProperties.ProviderConfig config = new LlmProperties.ProviderConfig(
                "groq", ProviderType.OPENAI, 1, "https://api.groq.test/openai/v1", "secret",
                "llama-3.1-8b-instant", 30, 0, true, 30);
        adapter = new OpenAiCompatibleAdapter(httpClient, mapper, config);
    }

    @Test
    @DisplayName("should parse the first choice and reported usage")
    void parsesReply() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"id":"c1","model":"llama-3.1-8b-instant",
                 "choices":[{"index":0,"message":{"role":"assistant","content":"Hello!"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":12,"completion_tokens":3,"total_tokens":15}}
                """);
        doReturn(response).when(httpClient).send(any(), any());

        ProviderReply reply = adapter.send(PROMPT, PARAMS);

        assertThat(reply.text()).isEqualTo("Hello!");
        assertThat(reply.tokensUsed()).isEqualTo(15);
        assertThat(reply.model()).isEqualTo("llama-3.1-8b-instant");

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString())
                .isEqualTo("https://api.groq.test/openai/v1/chat/completions");
        assertThat(request.getValue().headers().firstValue("Authorization")).hasValue("Bearer secret");
    }

    @Test
    @DisplayName("should report HTTP 429 as RATE_LIMITED")
    void rateLimited() throws Exception {
        when(response.statusCode()).thenReturn(429);
        when(response.body()).thenReturn("{\"error\":\"slow down\"}");
        doReturn(response).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> adapter.send(PROMPT, PARAMS))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).getKind()).isEqualTo(FailureKind.RATE_LIMITED));
    }

    @Test
    @DisplayName("should report an empty choice list as INVALID_RESPONSE")
    void emptyChoices() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"choices\":[]}");
        doReturn(response).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> adapter.send(PROMPT, PARAMS))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).getKind()).isEqualTo(FailureKind.INVALID_RESPONSE));
    }

    @Test
    @DisplayName("should report malformed JSON as INVALID_RESPONSE")
    void malformedBody() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("<html>gateway</html>");
        doReturn(response).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> adapter.send(PROMPT, PARAMS))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).getKind()).isEqualTo(FailureKind.INVALID_RESPONSE));
    }

    @Test
    @DisplayName("should report network errors as TRANSIENT_ERROR")
    void networkError() throws Exception {
        doThrow(new HttpConnectTimeoutException("connect timed out")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> adapter.send(PROMPT, PARAMS))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).getKind()).isEqualTo(FailureKind.TRANSIENT_ERROR));
    }
}
