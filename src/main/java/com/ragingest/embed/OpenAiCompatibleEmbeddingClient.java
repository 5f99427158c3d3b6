package com.ragingest.embed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OpenAiCompatibleEmbeddingClient implements EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int ERROR_SNIPPET_LENGTH = 200;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int dimension;
    private final RetryExecutor retryExecutor;

    public OpenAiCompatibleEmbeddingClient(OkHttpClient httpClient,
            String baseUrl,
            String apiKey,
            String model,
            int dimension,
            RetryExecutor retryExecutor) {
        this.httpClient = httpClient;
        this.endpoint = trimTrailingSlash(baseUrl) + "/embeddings";
        this.apiKey = apiKey;
        this.model = model;
        this.dimension = dimension;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.NOT_CONFIGURED,
                    "Embedding API key not configured for model " + model);
        }

        List<Integer> positions = new ArrayList<>();
        List<String> inputs = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i) == null ? "" : texts.get(i).replace('\n', ' ').strip();
            if (!text.isEmpty()) {
                positions.add(i);
                inputs.add(text);
            }
        }

        float[][] vectors = new float[texts.size()][];
        int width = dimension;
        if (!inputs.isEmpty()) {
            RetryResult<List<float[]>> result = retryExecutor.execute("embeddings", attempt -> request(inputs));
            if (!result.succeeded()) {
                throw new EmbeddingServiceException(
                        EmbeddingServiceException.Kind.from(result.failureKind()),
                        "Embedding request " + result.failureMessage(),
                        result.failure());
            }
            List<float[]> embedded = result.value();
            for (int i = 0; i < embedded.size(); i++) {
                vectors[positions.get(i)] = embedded.get(i);
            }
            width = embedded.get(0).length;
        }
        for (int i = 0; i < vectors.length; i++) {
            if (vectors[i] == null) {
                vectors[i] = new float[width];
            }
        }
        log.debug("Embedded texts={} blank={} model={}", texts.size(), texts.size() - inputs.size(), model);
        return List.of(vectors);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String model() {
        return model;
    }

    private AttemptOutcome<List<float[]>> request(List<String> inputs) {
        Request request;
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "input", inputs));
            request = new Request.Builder()
                    .url(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(payload, JSON))
                    .build();
        } catch (IOException e) {
            return AttemptOutcome.failure(FailureKind.INVALID_REQUEST, e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String content = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                return AttemptOutcome.failure(FailureKind.fromHttpStatus(response.code()),
                        new IOException("HTTP " + response.code() + ": " + snippet(content)));
            }
            return parse(content, inputs.size());
        } catch (IOException e) {
            return AttemptOutcome.failure(FailureKind.TRANSIENT, e);
        }
    }

    private AttemptOutcome<List<float[]>> parse(String content, int expected) throws IOException {
        JsonNode data = mapper.readTree(content).path("data");
        if (!data.isArray() || data.size() != expected) {
            return AttemptOutcome.failure(FailureKind.SERVER_ERROR,
                    new IOException("Expected " + expected + " embeddings but response held " + data.size()));
        }
        float[][] ordered = new float[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode entry = data.get(i);
            int index = entry.path("index").asInt(i);
            JsonNode values = entry.path("embedding");
            if (index < 0 || index >= expected || !values.isArray() || values.isEmpty()) {
                return AttemptOutcome.failure(FailureKind.SERVER_ERROR,
                        new IOException("Malformed embedding entry at position " + i));
            }
            float[] vector = new float[values.size()];
            for (int j = 0; j < values.size(); j++) {
                vector[j] = (float) values.get(j).asDouble();
            }
            ordered[index] = vector;
        }
        for (int i = 0; i < ordered.length; i++) {
            if (ordered[i] == null) {
                return AttemptOutcome.failure(FailureKind.SERVER_ERROR,
                        new IOException("Missing embedding for input index " + i));
            }
        }
        return AttemptOutcome.success(List.of(ordered));
    }

    private static String snippet(String content) {
        String trimmed = content == null ? "" : content.strip();
        return trimmed.length() <= ERROR_SNIPPET_LENGTH ? trimmed : trimmed.substring(0, ERROR_SNIPPET_LENGTH) + "...";
    }

    private static String trimTrailingSlash(String url) {
        String value = url == null ? "" : url.strip();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
