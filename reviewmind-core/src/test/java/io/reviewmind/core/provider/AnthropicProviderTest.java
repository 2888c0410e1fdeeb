package io.reviewmind.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.reviewmind.core.model.ChatMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnthropicProviderTest {

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
    void shouldParseTextFromMessagesApi() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "content": [
                    {"type": "text", "text": "Validate the amount "},
                    {"type": "text", "text": "before charging."}
                  ],
                  "usage": {"input_tokens": 10, "output_tokens": 7}
                }
                """));

        AnthropicProvider provider = new AnthropicProvider(
            "anthropic",
            "sk-ant",
            server.url("/v1/").toString(),
            Duration.ofSeconds(5),
            1
        );

        LlmResponse response = provider.chat(
            "claude-3-5-sonnet-20241022",
            List.of(ChatMessage.system("sys"), ChatMessage.user("hi")),
            new GenerationOptions(300, 0.3)
        );

        assertThat(response.content()).isEqualTo("Validate the amount before charging.");
        assertThat(response.usage()).containsEntry("input_tokens", 10);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("sk-ant");
        assertThat(request.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        assertThat(request.getBody().readUtf8())
            .contains("\"model\":\"claude-3-5-sonnet-20241022\"")
            .contains("\"max_tokens\":300")
            .contains("\"system\":\"sys\"")
            .doesNotContain("\"role\":\"system\"");
    }
}
