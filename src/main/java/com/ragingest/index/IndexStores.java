package com.ragingest.index;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragingest.embed.RetryExecutor;
import com.ragingest.embed.RetryPolicy;
import com.ragingest.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class IndexStores {
    private static final Logger log = LoggerFactory.getLogger(IndexStores.class);

    private IndexStores() {
    }

    public static IndexStore fromConfig(AppConfig.IndexConfig config, OkHttpClient httpClient) {
        String type = config.getType().toLowerCase(Locale.ROOT);
        if (type.equals("qdrant")) {
            log.info("Using index store=qdrant endpoint={} collection={}", config.getEndpoint(), config.getCollection());
            RetryPolicy policy = new RetryPolicy(config.getMaxRetries(), Duration.ofMillis(config.getRetryBackoffMs()));
            return new QdrantIndexStore(httpClient, config.getEndpoint(), config.getApiKey(), config.getCollection(),
                    new RetryExecutor(policy));
        }
        if (type.equals("local")) {
            log.info("Using index store=local path={} collection={}", config.getLocalPath(), config.getCollection());
            return new LocalJsonIndexStore(Path.of(config.getLocalPath()), config.getCollection());
        }
        throw new IllegalArgumentException("Unsupported vector database type: " + config.getType());
    }
}
