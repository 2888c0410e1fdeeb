package io.reviewmind.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reviewmind.core.external.ExternalCallException;
import io.reviewmind.core.model.ChatMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendChatCompletionWithExtraHeaders() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "  Add a guard clause.  " } }
                  ],
                  "usage": {"prompt_tokens": 12}
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openrouter",
            "sk-test",
            server.url("/api/v1/").toString(),
            Map.of("HTTP-Referer", "https://reviewmind.example"),
            Duration.ofSeconds(5),
            1
        );

        LlmResponse response = provider.chat("gpt-4o-mini", List.of(ChatMessage.user("review this")), new GenerationOptions(100, 0.0));

        assertThat(response.content()).isEqualTo("Add a guard clause.");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("HTTP-Referer")).isEqualTo("https://reviewmind.example");
        assertThat(request.getBody().readUtf8()).contains("\"role\":\"user\"").contains("\"max_tokens\":100");
    }

    @Test
    void shouldRaiseExternalCallExceptionOnHttpError() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad model\"}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai",
            "sk-test",
            server.url("/v1/").toString(),
            Map.of(),
            Duration.ofSeconds(5),
            1
        );

        assertThatThrownBy(() -> provider.chat("m", List.of(ChatMessage.user("x")), new GenerationOptions(10, 0.1)))
            .isInstanceOf(ExternalCallException.class)
            .hasMessageContaining("bad model");
    }
}
