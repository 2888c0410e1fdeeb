package io.reviewmind.core.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * POSTs JSON to a model endpoint with bounded time and retries. HTTP 429 and 5xx responses and
 * I/O errors are retried with exponential backoff; the final failure is raised as an
 * {@link ExternalCallException}, or {@link ExternalCallTimeoutException} when the call ran out of time.
 */
public final class JsonHttpCaller {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public JsonHttpCaller(String name, Duration timeout, int maxAttempts) {
        this.name = name;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(timeout)
            .writeTimeout(Duration.ofSeconds(20))
            .callTimeout(timeout)
            .build();
        this.mapper = new ObjectMapper();
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public JsonNode post(HttpUrl url, Map<String, String> headers, Map<String, Object> payload) {
        RequestBody body;
        try {
            body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (IOException e) {
            throw new ExternalCallException(name + ": failed to encode request", e);
        }

        Request.Builder builder = new Request.Builder()
            .url(url)
            .post(body)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        Request request = builder.build();

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                String raw = responseBody == null ? "" : responseBody.string();
                if (response.isSuccessful()) {
                    return mapper.readTree(raw.isBlank() ? "{}" : raw);
                }
                boolean retryable = response.code() == 429 || response.code() >= 500;
                if (retryable && attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new ExternalCallException(name + ": HTTP " + response.code() + " " + truncate(raw, 300));
            } catch (InterruptedIOException timeout) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new ExternalCallTimeoutException(name + ": call timed out", timeout);
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new ExternalCallException(name + ": " + ioe.getMessage(), ioe);
            }
        }
        throw new ExternalCallException(name + ": exhausted retries");
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException(name + ": interrupted while retrying", ie);
        }
    }
}
