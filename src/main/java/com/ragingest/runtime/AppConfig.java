package com.ragingest.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ragingest.source.SourceFiles;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IngestionConfig ingestion = new IngestionConfig();
    private IndexConfig index = new IndexConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private StatusConfig status = new StatusConfig();
    private SourceConfig source = new SourceConfig();

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public StatusConfig getStatus() {
        return status;
    }

    public void setStatus(StatusConfig status) {
        this.status = status == null ? new StatusConfig() : status;
    }

    public SourceConfig getSource() {
        return source;
    }

    public void setSource(SourceConfig source) {
        this.source = source == null ? new SourceConfig() : source;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private String documentSet = "";
        private String sourceType = "";
        private String sourceUri = "";
        private String format = "auto";
        private int chunkSize = 512;
        private int chunkOverlap = 100;
        private int batchSize = 16;

        public String getDocumentSet() {
            return documentSet;
        }

        public void setDocumentSet(String documentSet) {
            this.documentSet = documentSet == null ? "" : documentSet;
        }

        public String getSourceType() {
            return sourceType;
        }

        public void setSourceType(String sourceType) {
            this.sourceType = sourceType == null ? "" : sourceType;
        }

        public String getSourceUri() {
            return sourceUri;
        }

        public void setSourceUri(String sourceUri) {
            this.sourceUri = sourceUri == null ? "" : sourceUri;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format == null || format.isBlank() ? "auto" : format;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String type = "qdrant";
        private String endpoint = "http://localhost:6333";
        private String apiKey = "";
        private String collection = "";
        private String targetAlias = "";
        private String indexType = "HNSW";
        private Map<String, String> parameters = new LinkedHashMap<>();
        private String localPath = ".rag-ingest/index-store.json";
        private long pollIntervalMs = 5000;
        private long maxWaitMs = 300000;
        private int timeoutMs = 60000;
        private int maxRetries = 3;
        private long retryBackoffMs = 1000;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type == null || type.isBlank() ? "qdrant" : type;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint == null || endpoint.isBlank() ? "http://localhost:6333" : endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection == null ? "" : collection;
        }

        public String getTargetAlias() {
            return targetAlias;
        }

        public void setTargetAlias(String targetAlias) {
            this.targetAlias = targetAlias == null ? "" : targetAlias;
        }

        public String getIndexType() {
            return indexType;
        }

        public void setIndexType(String indexType) {
            this.indexType = indexType == null || indexType.isBlank() ? "HNSW" : indexType;
        }

        public Map<String, String> getParameters() {
            return parameters;
        }

        public void setParameters(Map<String, String> parameters) {
            this.parameters = parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters);
        }

        public String getLocalPath() {
            return localPath;
        }

        public void setLocalPath(String localPath) {
            this.localPath = localPath == null || localPath.isBlank() ? ".rag-ingest/index-store.json" : localPath;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getMaxWaitMs() {
            return maxWaitMs;
        }

        public void setMaxWaitMs(long maxWaitMs) {
            this.maxWaitMs = maxWaitMs;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "openai";
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private String model = "text-embedding-3-small";
        private int dimension = 0;
        private int maxRetries = 3;
        private long retryBackoffMs = 30000;
        private int timeoutMs = 60000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider == null || provider.isBlank() ? "openai" : provider;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com/v1" : baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model == null || model.isBlank() ? "text-embedding-3-small" : model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatusConfig {
        private String filePath = "/tmp/job-status.json";
        private boolean useKubernetesApi = false;
        private String namespace = "default";
        private String indexJobName = "";

        public String getFilePath() {
            return filePath;
        }

        public void setFilePath(String filePath) {
            this.filePath = filePath == null || filePath.isBlank() ? "/tmp/job-status.json" : filePath;
        }

        public boolean isUseKubernetesApi() {
            return useKubernetesApi;
        }

        public void setUseKubernetesApi(boolean useKubernetesApi) {
            this.useKubernetesApi = useKubernetesApi;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace;
        }

        public String getIndexJobName() {
            return indexJobName;
        }

        public void setIndexJobName(String indexJobName) {
            this.indexJobName = indexJobName == null ? "" : indexJobName;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceConfig {
        private static final List<String> SUPPORTED = SourceFiles.SUPPORTED_EXTENSIONS;

        private String region = "us-east-1";
        private String s3Endpoint = "";
        private int gitCloneTimeoutSeconds = 300;
        private String gitWorkDir = "";
        private List<String> extensions = new ArrayList<>(SUPPORTED);

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region == null || region.isBlank() ? "us-east-1" : region;
        }

        public String getS3Endpoint() {
            return s3Endpoint;
        }

        public void setS3Endpoint(String s3Endpoint) {
            this.s3Endpoint = s3Endpoint == null ? "" : s3Endpoint;
        }

        public int getGitCloneTimeoutSeconds() {
            return gitCloneTimeoutSeconds;
        }

        public void setGitCloneTimeoutSeconds(int gitCloneTimeoutSeconds) {
            this.gitCloneTimeoutSeconds = gitCloneTimeoutSeconds;
        }

        public String getGitWorkDir() {
            return gitWorkDir;
        }

        public void setGitWorkDir(String gitWorkDir) {
            this.gitWorkDir = gitWorkDir == null ? "" : gitWorkDir;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null || extensions.isEmpty() ? new ArrayList<>(SUPPORTED) : new ArrayList<>(extensions);
        }
    }
}
