package io.reviewmind.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reviewmind.core.external.ExternalCallException;
import java.io.IOException;
import java.time.Duration;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiEmbeddingClientTest {

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
    void shouldRequestEmbeddingWithConfiguredDimensions() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"data": [{"embedding": [0.25, -0.5, 1.0]}], "model": "text-embedding-3-small"}
                """));

        OpenAiEmbeddingClient client = new OpenAiEmbeddingClient(
            "sk-test",
            server.url("/v1/").toString(),
            "text-embedding-3-small",
            3,
            Duration.ofSeconds(5),
            1
        );

        float[] vector = client.embed("int total = a + b;");

        assertThat(vector).containsExactly(0.25f, -0.5f, 1.0f);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/embeddings");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"text-embedding-3-small\"").contains("\"dimensions\":3");
    }

    @Test
    void shouldFailOnMalformedResponse() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{\"data\": []}"));

        OpenAiEmbeddingClient client = new OpenAiEmbeddingClient(
            "sk-test",
            server.url("/v1/").toString(),
            "text-embedding-3-small",
            0,
            Duration.ofSeconds(5),
            1
        );

        assertThatThrownBy(() -> client.embed("x"))
            .isInstanceOf(ExternalCallException.class)
            .hasMessageContaining("no embedding");
    }

    @Test
    void shouldFailWithoutApiKey() {
        OpenAiEmbeddingClient client = new OpenAiEmbeddingClient(
            "",
            server.url("/v1/").toString(),
            "text-embedding-3-small",
            0,
            Duration.ofSeconds(5),
            1
        );

        assertThatThrownBy(() -> client.embed("x")).isInstanceOf(ExternalCallException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
