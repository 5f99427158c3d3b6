package com.ragingest.index;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ragingest.embed.AttemptOutcome;
import com.ragingest.embed.FailureKind;
import com.ragingest.embed.RetryExecutor;
import com.ragingest.embed.RetryResult;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class QdrantIndexStore implements IndexStore {
    private static final Logger log = LoggerFactory.getLogger(QdrantIndexStore.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int CREATE_HNSW_M = 16;
    private static final int CREATE_EF_CONSTRUCT = 100;
    private static final int CREATE_INDEXING_THRESHOLD = 20000;
    private static final int TUNE_HNSW_M = 16;
    private static final int TUNE_EF_CONSTRUCT = 200;
    private static final int TUNE_INDEXING_THRESHOLD = 10000;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String apiKey;
    private final String collection;
    private final RetryExecutor retryExecutor;

    public QdrantIndexStore(OkHttpClient httpClient, String baseUrl, String apiKey, String collection, RetryExecutor retryExecutor) {
        this.httpClient = httpClient;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey == null ? "" : apiKey;
        this.collection = collection;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public String collectionName() {
        return collection;
    }

    @Override
    public void ensureCollection(int dimension) {
        Optional<CollectionInfo> existing = getCollectionInfo();
        if (existing.isPresent()) {
            int current = existing.get().dimension();
            if (current > 0 && current != dimension) {
                throw new IndexStoreException(IndexStoreException.Kind.DIMENSION_MISMATCH,
                        "Collection " + collection + " has dimension " + current + " but embeddings have " + dimension);
            }
            log.info("Collection {} already exists dimension={} vectors={}", collection, current, existing.get().vectorCount());
            return;
        }

        ObjectNode body = mapper.createObjectNode();
        ObjectNode vectors = body.putObject("vectors");
        vectors.put("size", dimension);
        vectors.put("distance", "Cosine");
        body.putObject("optimizers_config").put("indexing_threshold", CREATE_INDEXING_THRESHOLD);
        ObjectNode hnsw = body.putObject("hnsw_config");
        hnsw.put("m", CREATE_HNSW_M);
        hnsw.put("ef_construct", CREATE_EF_CONSTRUCT);

        HttpResult result = send("create-collection", "PUT", collectionPath(), body, IndexStoreException.Kind.UNAVAILABLE);
        if (result.code() == 409) {
            log.info("Collection {} was created concurrently", collection);
            return;
        }
        requireSuccess(result, "Create collection " + collection, IndexStoreException.Kind.REQUEST_FAILED);
        log.info("Created collection {} dimension={} distance=Cosine", collection, dimension);
    }

    @Override
    public void upsert(List<Point> points) {
        if (points.isEmpty()) {
            return;
        }
        ObjectNode body = mapper.createObjectNode();
        ArrayNode pointsNode = body.putArray("points");
        for (Point point : points) {
            ObjectNode pointNode = pointsNode.addObject();
            pointNode.put("id", point.id());
            ArrayNode vectorNode = pointNode.putArray("vector");
            for (float value : point.vector()) {
                vectorNode.add(value);
            }
            pointNode.set("payload", mapper.valueToTree(point.payload()));
        }

        HttpResult result = send("upsert", "PUT", collectionPath() + "/points?wait=true", body, IndexStoreException.Kind.UPSERT_FAILED);
        requireSuccess(result, "Upsert of " + points.size() + " points into " + collection, IndexStoreException.Kind.UPSERT_FAILED);
        log.debug("Upserted points={} collection={}", points.size(), collection);
    }

    @Override
    public Optional<CollectionInfo> getCollectionInfo() {
        HttpResult result = send("get-collection", "GET", collectionPath(), null, IndexStoreException.Kind.UNAVAILABLE);
        if (result.code() == 404) {
            return Optional.empty();
        }
        requireSuccess(result, "Get collection " + collection, IndexStoreException.Kind.REQUEST_FAILED);

        JsonNode info = readBody(result).path("result");
        long vectorCount = info.path("points_count").asLong(info.path("vectors_count").asLong(0));
        JsonNode vectors = info.path("config").path("params").path("vectors");
        int dimension = vectors.path("size").asInt(0);
        return Optional.of(new CollectionInfo(collection, vectorCount, info.path("status").asText("unknown"), dimension));
    }

    @Override
    public void applyIndexParameters(String indexType, Map<String, String> parameters) {
        if (indexType != null && !indexType.isBlank() && !indexType.equalsIgnoreCase("HNSW")) {
            log.warn("Index type {} is not tunable on Qdrant, only HNSW parameters are applied", indexType);
            return;
        }
        ObjectNode body = mapper.createObjectNode();
        ObjectNode hnsw = body.putObject("hnsw_config");
        hnsw.put("m", intParameter(parameters, TUNE_HNSW_M, "m"));
        hnsw.put("ef_construct", intParameter(parameters, TUNE_EF_CONSTRUCT, "efconstruction", "ef_construct", "ef_construction"));
        body.putObject("optimizers_config")
                .put("indexing_threshold", intParameter(parameters, TUNE_INDEXING_THRESHOLD, "indexing_threshold"));

        HttpResult result = send("update-collection", "PATCH", collectionPath(), body, IndexStoreException.Kind.UNAVAILABLE);
        requireSuccess(result, "Update index parameters of " + collection, IndexStoreException.Kind.REQUEST_FAILED);
        log.info("Applied index parameters collection={} hnsw={}", collection, hnsw);
    }

    @Override
    public void createAlias(String alias, String targetCollection) {
        ObjectNode body = mapper.createObjectNode();
        body.putArray("actions").add(createAliasAction(alias, targetCollection));
        HttpResult result = send("create-alias", "POST", "/collections/aliases", body, IndexStoreException.Kind.UNAVAILABLE);
        requireSuccess(result, "Create alias " + alias, IndexStoreException.Kind.REQUEST_FAILED);
        log.info("Created alias {} -> {}", alias, targetCollection);
    }

    @Override
    public void switchAlias(String alias, String targetCollection) {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode actions = body.putArray("actions");
        actions.addObject().putObject("delete_alias").put("alias_name", alias);
        actions.add(createAliasAction(alias, targetCollection));

        HttpResult result = send("switch-alias", "POST", "/collections/aliases", body, IndexStoreException.Kind.UNAVAILABLE);
        if (result.isSuccessful()) {
            log.info("Switched alias {} -> {}", alias, targetCollection);
            return;
        }
        if (isMissingAlias(result)) {
            log.info("Alias {} does not exist yet, creating it", alias);
            createAlias(alias, targetCollection);
            return;
        }
        throw failure(result, "Switch alias " + alias, IndexStoreException.Kind.REQUEST_FAILED);
    }

    @Override
    public List<AliasBinding> listAliases() {
        HttpResult result = send("list-aliases", "GET", collectionPath() + "/aliases", null, IndexStoreException.Kind.UNAVAILABLE);
        if (result.code() == 404) {
            return List.of();
        }
        requireSuccess(result, "List aliases of " + collection, IndexStoreException.Kind.REQUEST_FAILED);
        List<AliasBinding> aliases = new ArrayList<>();
        for (JsonNode alias : readBody(result).path("result").path("aliases")) {
            aliases.add(new AliasBinding(alias.path("alias_name").asText(), alias.path("collection_name").asText()));
        }
        return aliases;
    }

    @Override
    public boolean healthCheck() {
        try {
            HttpResult result = send("health-check", "GET", "/collections", null, IndexStoreException.Kind.UNAVAILABLE);
            if (!result.isSuccessful()) {
                log.warn("Qdrant health check failed status={}", result.code());
            }
            return result.isSuccessful();
        } catch (IndexStoreException e) {
            log.error("Qdrant health check failed: {}", e.getMessage());
            return false;
        }
    }

    private ObjectNode createAliasAction(String alias, String targetCollection) {
        ObjectNode action = mapper.createObjectNode();
        action.putObject("create_alias")
                .put("collection_name", targetCollection)
                .put("alias_name", alias);
        return action;
    }

    private HttpResult send(String operation, String method, String path, JsonNode body, IndexStoreException.Kind exhaustedKind) {
        HttpUrl url = HttpUrl.parse(baseUrl + path);
        if (url == null) {
            throw new IndexStoreException(IndexStoreException.Kind.REQUEST_FAILED, "Invalid Qdrant URL: " + baseUrl + path);
        }
        RequestBody requestBody = null;
        if (body != null) {
            try {
                requestBody = RequestBody.create(mapper.writeValueAsString(body), JSON);
            } catch (JsonProcessingException e) {
                throw new IndexStoreException(IndexStoreException.Kind.REQUEST_FAILED, "Cannot serialize " + operation + " request", e);
            }
        }
        Request.Builder builder = new Request.Builder().url(url).method(method, requestBody);
        if (!apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        Request request = builder.build();

        RetryResult<HttpResult> result = retryExecutor.execute("qdrant " + operation, attempt -> execute(request));
        if (!result.succeeded()) {
            throw new IndexStoreException(exhaustedKind,
                    "Qdrant " + operation + " on " + collection + " " + result.failureMessage(), result.failure());
        }
        return result.value();
    }

    private AttemptOutcome<HttpResult> execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String content = responseBody == null ? "" : responseBody.string();
            int code = response.code();
            if (code == 429 || code >= 500) {
                return AttemptOutcome.failure(FailureKind.fromHttpStatus(code),
                        new IOException("HTTP " + code + ": " + errorMessage(content)));
            }
            return AttemptOutcome.success(new HttpResult(code, content));
        } catch (IOException e) {
            return AttemptOutcome.failure(FailureKind.TRANSIENT, e);
        }
    }

    private void requireSuccess(HttpResult result, String action, IndexStoreException.Kind kind) {
        if (!result.isSuccessful()) {
            throw failure(result, action, kind);
        }
    }

    private IndexStoreException failure(HttpResult result, String action, IndexStoreException.Kind kind) {
        return new IndexStoreException(kind, action + " failed: HTTP " + result.code() + " " + errorMessage(result.body()));
    }

    private boolean isMissingAlias(HttpResult result) {
        if (result.code() == 404) {
            return true;
        }
        String message = errorMessage(result.body()).toLowerCase(Locale.ROOT);
        return result.code() >= 400 && result.code() < 500 && message.contains("alias")
                && (message.contains("not found") || message.contains("does not exist"));
    }

    private JsonNode readBody(HttpResult result) {
        try {
            return mapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new IndexStoreException(IndexStoreException.Kind.REQUEST_FAILED, "Malformed Qdrant response: " + e.getOriginalMessage(), e);
        }
    }

    private String errorMessage(String content) {
        if (content == null || content.isBlank()) {
            return "";
        }
        try {
            JsonNode error = mapper.readTree(content).path("status").path("error");
            return error.isTextual() ? error.asText() : content.strip();
        } catch (JsonProcessingException e) {
            return content.strip();
        }
    }

    private String collectionPath() {
        return "/collections/" + collection;
    }

    static int intParameter(Map<String, String> parameters, int fallback, String... names) {
        for (String name : names) {
            for (Map.Entry<String, String> entry : parameters.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    try {
                        return Integer.parseInt(entry.getValue().trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Index parameter " + entry.getKey() + " is not an integer: " + entry.getValue(), e);
                    }
                }
            }
        }
        return fallback;
    }

    private static String stripTrailingSlash(String url) {
        String value = url == null ? "" : url.strip();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    record HttpResult(int code, String body) {
        boolean isSuccessful() {
            return code >= 200 && code < 300;
        }
    }
}
