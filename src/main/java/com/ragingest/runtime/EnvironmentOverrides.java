package com.ragingest.runtime;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

public final class EnvironmentOverrides {
    private static final String INDEX_PARAM_PREFIX = "INDEX_PARAM_";

    private EnvironmentOverrides() {
    }

    public static AppConfig apply(AppConfig config, Map<String, String> environment) {
        AppConfig.IngestionConfig ingestion = config.getIngestion();
        text(environment, "DOCUMENT_SET_NAME", ingestion::setDocumentSet);
        text(environment, "SOURCE_TYPE", ingestion::setSourceType);
        text(environment, "SOURCE_URI", ingestion::setSourceUri);
        text(environment, "DOCUMENT_FORMAT", ingestion::setFormat);
        integer(environment, "CHUNK_SIZE", ingestion::setChunkSize);
        integer(environment, "CHUNK_OVERLAP", ingestion::setChunkOverlap);
        integer(environment, "BATCH_SIZE", ingestion::setBatchSize);
        integer(environment, "JOB_BATCH_SIZE", ingestion::setBatchSize);

        AppConfig.IndexConfig index = config.getIndex();
        text(environment, "VECTOR_DB_TYPE", index::setType);
        text(environment, "VECTOR_DB_COLLECTION", index::setCollection);
        text(environment, "QDRANT_URL", index::setEndpoint);
        text(environment, "VECTOR_DB_ENDPOINT", index::setEndpoint);
        text(environment, "QDRANT_API_KEY", index::setApiKey);
        text(environment, "TARGET_ALIAS", index::setTargetAlias);
        text(environment, "INDEX_TYPE", index::setIndexType);
        Map<String, String> parameters = new TreeMap<>(index.getParameters());
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().startsWith(INDEX_PARAM_PREFIX) && entry.getKey().length() > INDEX_PARAM_PREFIX.length()) {
                String name = entry.getKey().substring(INDEX_PARAM_PREFIX.length()).toLowerCase(Locale.ROOT);
                parameters.put(name, entry.getValue());
            }
        }
        index.setParameters(parameters);

        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        text(environment, "EMBEDDING_PROVIDER", embedding::setProvider);
        text(environment, "EMBEDDING_MODEL", embedding::setModel);
        text(environment, "OPENAI_EMBEDDING_MODEL", embedding::setModel);
        integer(environment, "EMBEDDING_DIMENSION", embedding::setDimension);
        text(environment, "OPENAI_API_KEY", embedding::setApiKey);
        text(environment, "OPENAI_API_BASE", embedding::setBaseUrl);
        integer(environment, "JOB_MAX_RETRIES", embedding::setMaxRetries);
        integer(environment, "JOB_RETRY_BACKOFF", seconds -> embedding.setRetryBackoffMs(seconds * 1000L));

        AppConfig.StatusConfig status = config.getStatus();
        text(environment, "STATUS_FILE_PATH", status::setFilePath);
        text(environment, "USE_K8S_API", value -> status.setUseKubernetesApi(Boolean.parseBoolean(value.trim())));
        text(environment, "POD_NAMESPACE", status::setNamespace);
        text(environment, "DOCUMENT_SET_NAMESPACE", status::setNamespace);
        text(environment, "INDEX_JOB_NAME", status::setIndexJobName);

        AppConfig.SourceConfig source = config.getSource();
        text(environment, "AWS_REGION", source::setRegion);
        text(environment, "S3_ENDPOINT_URL", source::setS3Endpoint);
        integer(environment, "GIT_CLONE_TIMEOUT_SECONDS", source::setGitCloneTimeoutSeconds);
        return config;
    }

    private static void text(Map<String, String> environment, String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value != null && !value.isBlank()) {
            setter.accept(value);
        }
    }

    private static void integer(Map<String, String> environment, String name, Consumer<Integer> setter) {
        text(environment, name, value -> {
            try {
                setter.accept(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Environment variable " + name + " is not an integer: " + value, e);
            }
        });
    }
}
