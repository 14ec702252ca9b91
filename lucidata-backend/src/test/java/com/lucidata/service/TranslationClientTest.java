package com.lucidata.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lucidata.config.LucidataConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Translation client")
class TranslationClientTest {

    private static final String COMPLETION = "{\"choices\":[{\"message\":{\"role\":\"assistant\","
            + "\"content\":\"SQL: SELECT 1\\nEXPLANATION: one\\nCONFIDENCE: 0.9\"}}]}";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private TranslationClient client;

    @BeforeEach
    void setUp() {
        client = new TranslationClient(objectMapper, httpClient, config("sk-test"));
    }

    private static LucidataConfig config(String apiKey) {
        return new LucidataConfig(
                new LucidataConfig.Database(null, 5000, 30000, false),
                new LucidataConfig.Llm(apiKey, "gpt-4", "https://llm.example.com", 30000),
                new LucidataConfig.Web(null));
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(httpClient.<String>send(any(), any())).thenReturn(response);
    }

    @Nested
    @DisplayName("Successful completions")
    class Success {

        @Test
        @DisplayName("Returns the first choice's message content")
        void returnsContent() throws Exception {
            respond(200, COMPLETION);

            assertThat(client.translate("prompt", null)).isEqualTo("SQL: SELECT 1\nEXPLANATION: one\nCONFIDENCE: 0.9");
        }

        @Test
        @DisplayName("Posts a chat completion request with the default model")
        void requestShape() throws Exception {
            respond(200, COMPLETION);

            client.translate("the prompt", null);

            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            HttpRequest request = captor.getValue();
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.uri()).isEqualTo(URI.create("https://llm.example.com/v1/chat/completions"));
            assertThat(request.headers().firstValue("Authorization")).hasValue("Bearer sk-test");

            JsonNode payload = objectMapper.readTree(bodyOf(request));
            assertThat(payload.path("model").asText()).isEqualTo("gpt-4");
            assertThat(payload.path("temperature").asDouble()).isEqualTo(0.1);
            assertThat(payload.path("max_tokens").asInt()).isEqualTo(500);
            assertThat(payload.path("messages")).hasSize(2);
            assertThat(payload.path("messages").path(0).path("role").asText()).isEqualTo("system");
            assertThat(payload.path("messages").path(0).path("content").asText())
                    .isEqualTo(TranslationClient.SYSTEM_PROMPT);
            assertThat(payload.path("messages").path(1).path("role").asText()).isEqualTo("user");
            assertThat(payload.path("messages").path(1).path("content").asText()).isEqualTo("the prompt");
        }

        @Test
        @DisplayName("Honours a per-request model")
        void modelOverride() throws Exception {
            respond(200, COMPLETION);

            client.translate("prompt", "gpt-4o-mini");

            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            assertThat(objectMapper.readTree(bodyOf(captor.getValue())).path("model").asText())
                    .isEqualTo("gpt-4o-mini");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Refuses to call out without an API key")
        void notConfigured() throws Exception {
            TranslationClient unconfigured = new TranslationClient(objectMapper, httpClient, config(null));

            assertThatThrownBy(() -> unconfigured.translate("prompt", null))
                    .isInstanceOfSatisfying(ProviderException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ProviderException.Kind.NOT_CONFIGURED));
            verify(httpClient, never()).send(any(), any());
        }

        @Test
        @DisplayName("Maps 401 to an authentication failure")
        void unauthorized() throws Exception {
            respond(401, "{\"error\":{\"message\":\"Incorrect API key provided\"}}");

            assertThatThrownBy(() -> client.translate("prompt", null))
                    .isInstanceOfSatisfying(ProviderException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ProviderException.Kind.AUTHENTICATION);
                        assertThat(e.getMessage()).isEqualTo(
                                "Language model API error: HTTP 401 - Incorrect API key provided");
                    });
        }

        @Test
        @DisplayName("Maps 429 to a rate-limit failure")
        void rateLimited() throws Exception {
            respond(429, "slow down");

            assertThatThrownBy(() -> client.translate("prompt", null))
                    .isInstanceOfSatisfying(ProviderException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ProviderException.Kind.RATE_LIMITED);
                        assertThat(e.getMessage()).endsWith("HTTP 429 - slow down");
                    });
        }

        @Test
        @DisplayName("Maps other error statuses to an upstream failure")
        void upstream() throws Exception {
            respond(503, "");

            assertThatThrownBy(() -> client.translate("prompt", null))
                    .isInstanceOfSatisfying(ProviderException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ProviderException.Kind.UPSTREAM);
                        assertThat(e.getMessage()).isEqualTo("Language model API error: HTTP 503");
                    });
        }

        @Test
        @DisplayName("Maps transport errors to network and timeout failures")
        void transport() throws Exception {
            when(httpClient.<String>send(any(), any()))
                    .thenThrow(new ConnectException("Connection refused"))
                    .thenThrow(new HttpTimeoutException("request timed out"));

            assertThatThrownBy(() -> client.translate("prompt", null))
                    .isInstanceOfSatisfying(ProviderException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ProviderException.Kind.NETWORK));
            assertThatThrownBy(() -> client.translate("prompt", null))
                    .isInstanceOfSatisfying(ProviderException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ProviderException.Kind.TIMEOUT));
        }

        @Test
        @DisplayName("Rejects bodies that are not chat completions")
        void invalidResponse() throws Exception {
            respond(200, "<html>gateway</html>");
            assertThatThrownBy(() -> client.translate("prompt", null))
                    .isInstanceOfSatisfying(ProviderException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ProviderException.Kind.INVALID_RESPONSE));
        }

        @Test
        @DisplayName("Rejects completions without message content")
        void missingContent() throws Exception {
            respond(200, "{\"choices\":[]}");
            assertThatThrownBy(() -> client.translate("prompt", null))
                    .isInstanceOfSatisfying(ProviderException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ProviderException.Kind.INVALID_RESPONSE));
        }
    }

    @Test
    @DisplayName("Resolves blank model names to the configured default")
    void resolveModel() {
        assertThat(client.resolveModel(null)).isEqualTo("gpt-4");
        assertThat(client.resolveModel("  ")).isEqualTo("gpt-4");
        assertThat(client.resolveModel(" gpt-3.5-turbo ")).isEqualTo("gpt-3.5-turbo");
    }

    private static String bodyOf(HttpRequest request) {
        HttpRequest.BodyPublisher publisher = request.bodyPublisher().orElseThrow();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        publisher.subscribe(new Flow.Subscriber<ByteBuffer>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                byte[] bytes = new byte[item.remaining()];
                item.get(bytes);
                out.write(bytes, 0, bytes.length);
            }

            @Override
            public void onError(Throwable throwable) {
                throw new IllegalStateException(throwable);
            }

            @Override
            public void onComplete() {
            }
        });
        return out.toString(StandardCharsets.UTF_8);
    }
}
