package com.ragingest.embed;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OpenAiCompatibleEmbeddingClientTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final List<JsonNode> requests = new ArrayList<>();
    private final List<String> authorizations = new ArrayList<>();
    private HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldEmbedNonBlankTextsAndZeroFillBlankOnes() throws Exception {
        start(exchange -> {
            JsonNode request = record(exchange);
            StringBuilder data = new StringBuilder();
            for (int i = request.path("input").size() - 1; i >= 0; i--) {
                data.append(data.length() == 0 ? "" : ",")
                        .append("{\"index\":").append(i).append(",\"embedding\":[").append(i + 1).append(",0.5,0.25]}");
            }
            respond(exchange, 200, "{\"data\":[" + data + "]}");
        });

        List<float[]> vectors = client(3, "secret").embed(List.of("first\nline", "   ", "second"));

        assertEquals(3, vectors.size());
        assertArrayEquals(new float[] { 1f, 0.5f, 0.25f }, vectors.get(0));
        assertArrayEquals(new float[3], vectors.get(1));
        assertArrayEquals(new float[] { 2f, 0.5f, 0.25f }, vectors.get(2));
        JsonNode request = requests.get(0);
        assertEquals("text-embedding-3-small", request.path("model").asText());
        assertEquals("first line", request.path("input").get(0).asText());
        assertEquals(2, request.path("input").size());
        assertEquals("Bearer secret", authorizations.get(0));
    }

    @Test
    void shouldRetryRateLimitedRequests() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(exchange -> {
            record(exchange);
            if (calls.incrementAndGet() == 1) {
                respond(exchange, 429, "{\"error\":{\"message\":\"slow down\"}}");
                return;
            }
            respond(exchange, 200, "{\"data\":[{\"index\":0,\"embedding\":[0.1,0.2]}]}");
        });

        List<float[]> vectors = client(2, "secret").embed(List.of("hello"));

        assertEquals(2, calls.get());
        assertEquals(2, vectors.get(0).length);
    }

    @Test
    void shouldFailFastOnClientErrors() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(exchange -> {
            record(exchange);
            calls.incrementAndGet();
            respond(exchange, 401, "{\"error\":{\"message\":\"bad key\"}}");
        });

        EmbeddingServiceException error = assertThrows(EmbeddingServiceException.class,
                () -> client(2, "wrong").embed(List.of("hello")));

        assertEquals(EmbeddingServiceException.Kind.INVALID_REQUEST, error.kind());
        assertEquals(1, calls.get());
    }

    @Test
    void shouldSurfaceServiceUnavailableAfterExhaustingRetries() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(exchange -> {
            record(exchange);
            calls.incrementAndGet();
            respond(exchange, 503, "overloaded");
        });

        EmbeddingServiceException error = assertThrows(EmbeddingServiceException.class,
                () -> client(2, "secret").embed(List.of("hello")));

        assertEquals(EmbeddingServiceException.Kind.SERVICE_UNAVAILABLE, error.kind());
        assertEquals(3, calls.get());
    }

    @Test
    void shouldRequireApiKey() {
        OpenAiCompatibleEmbeddingClient client = new OpenAiCompatibleEmbeddingClient(new OkHttpClient(),
                "http://127.0.0.1:9", "", "text-embedding-3-small", 3,
                new RetryExecutor(new RetryPolicy(0, Duration.ZERO), duration -> { }));

        EmbeddingServiceException error = assertThrows(EmbeddingServiceException.class, () -> client.embed(List.of("x")));

        assertEquals(EmbeddingServiceException.Kind.NOT_CONFIGURED, error.kind());
    }

    @Test
    void shouldReturnZeroVectorsWithoutCallingServiceWhenAllTextsAreBlank() throws Exception {
        start(exchange -> {
            record(exchange);
            respond(exchange, 500, "unexpected");
        });

        List<float[]> vectors = client(4, "secret").embed(Arrays.asList("", null, "  "));

        assertEquals(3, vectors.size());
        assertArrayEquals(new float[4], vectors.get(1));
        assertEquals(0, requests.size());
    }

    private OpenAiCompatibleEmbeddingClient client(int dimension, String apiKey) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/";
        return new OpenAiCompatibleEmbeddingClient(new OkHttpClient(), baseUrl, apiKey, "text-embedding-3-small", dimension,
                new RetryExecutor(new RetryPolicy(2, Duration.ofMillis(1)), duration -> { }));
    }

    private void start(Handler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/embeddings", handler::handle);
        server.start();
    }

    private JsonNode record(HttpExchange exchange) throws IOException {
        JsonNode body = mapper.readTree(exchange.getRequestBody());
        synchronized (requests) {
            requests.add(body);
            authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
        }
        return body;
    }

    private static void respond(HttpExchange exchange, int status, String payload) throws IOException {
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream body = exchange.getResponseBody()) {
            body.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
