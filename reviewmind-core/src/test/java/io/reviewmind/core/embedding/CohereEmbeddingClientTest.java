package io.reviewmind.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.Duration;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CohereEmbeddingClientTest {

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
    void shouldEmbedTextAsSearchDocument() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"id": "e1", "embeddings": [[1.5, 2.5]]}
                """));

        CohereEmbeddingClient client = new CohereEmbeddingClient(
            "co-test",
            server.url("/v1/").toString(),
            "embed-english-v3.0",
            Duration.ofSeconds(5),
            1
        );

        assertThat(client.embed("return null;")).containsExactly(1.5f, 2.5f);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/embed");
        assertThat(request.getBody().readUtf8())
            .contains("\"texts\":[\"return null;\"]")
            .contains("\"input_type\":\"search_document\"");
    }
}
