package com.ragingest.embed;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragingest.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingClients {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingClients.class);
    private static final int DEFAULT_DIMENSION = 1536;
    private static final Map<String, Integer> MODEL_DIMENSIONS = Map.of(
            "text-embedding-3-small", 1536,
            "text-embedding-3-large", 3072,
            "text-embedding-ada-002", 1536,
            "bge-large", 1024,
            "bge-base", 768,
            "bge-small", 384);

    private EmbeddingClients() {
    }

    public static int dimensionFor(String model, int configuredDimension) {
        if (configuredDimension > 0) {
            return configuredDimension;
        }
        if (model == null) {
            return DEFAULT_DIMENSION;
        }
        String normalized = model.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Integer> entry : MODEL_DIMENSIONS.entrySet()) {
            if (normalized.equals(entry.getKey()) || normalized.endsWith("/" + entry.getKey())
                    || normalized.contains(entry.getKey() + "-")) {
                return entry.getValue();
            }
        }
        return DEFAULT_DIMENSION;
    }

    public static EmbeddingClient fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String provider = config.getProvider().toLowerCase(Locale.ROOT);
        int dimension = dimensionFor(config.getModel(), config.getDimension());
        if (provider.equals("hashing") || provider.equals("local")) {
            log.info("Using embedding provider=hashing dimension={}", dimension);
            return new HashingEmbeddingClient(dimension);
        }
        if (provider.equals("openai") || provider.equals("openai-compatible")) {
            log.info("Using embedding provider={} model={} dimension={} baseUrl={}",
                    provider, config.getModel(), dimension, config.getBaseUrl());
            RetryPolicy policy = new RetryPolicy(config.getMaxRetries(), Duration.ofMillis(config.getRetryBackoffMs()));
            return new OpenAiCompatibleEmbeddingClient(
                    httpClient,
                    config.getBaseUrl(),
                    config.getApiKey(),
                    config.getModel(),
                    dimension,
                    new RetryExecutor(policy));
        }
        throw new IllegalArgumentException("Unsupported embedding provider: " + config.getProvider());
    }
}
