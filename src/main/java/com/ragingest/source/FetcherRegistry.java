package com.ragingest.source;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragingest.runtime.AppConfig;

import okhttp3.OkHttpClient;

public class FetcherRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetcherRegistry.class);

    private final Map<String, DocumentFetcher> fetchers = new LinkedHashMap<>();

    public FetcherRegistry register(String scheme, DocumentFetcher fetcher) {
        fetchers.put(scheme.toLowerCase(Locale.ROOT), fetcher);
        return this;
    }

    public DocumentFetcher resolve(String sourceType, String uri) throws SourceException {
        String scheme = sourceType == null || sourceType.isBlank() ? schemeOf(uri) : sourceType.toLowerCase(Locale.ROOT);
        DocumentFetcher fetcher = fetchers.get(scheme);
        if (fetcher == null) {
            throw new SourceException(SourceException.Kind.UNSUPPORTED_SOURCE_KIND,
                    "Unsupported source type '" + scheme + "', supported: " + fetchers.keySet());
        }
        return fetcher;
    }

    public Set<String> schemes() {
        return new LinkedHashSet<>(fetchers.keySet());
    }

    public static String schemeOf(String uri) {
        if (uri == null) {
            return "file";
        }
        int separator = uri.indexOf("://");
        if (separator > 0) {
            return uri.substring(0, separator).toLowerCase(Locale.ROOT);
        }
        return "file";
    }

    public static FetcherRegistry defaults(AppConfig.SourceConfig config, OkHttpClient httpClient) {
        FilesystemFetcher filesystem = new FilesystemFetcher(config.getExtensions());
        Path gitWorkDir = config.getGitWorkDir().isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"))
                : Path.of(config.getGitWorkDir());
        GitFetcher git = new GitFetcher(
                new GitCommandRunner(Duration.ofSeconds(config.getGitCloneTimeoutSeconds())),
                filesystem,
                gitWorkDir);
        ObjectStorageFetcher objectStorage = new ObjectStorageFetcher(
                new S3ObjectStorageClient(config.getRegion(), config.getS3Endpoint()),
                config.getExtensions());
        HttpFetcher http = new HttpFetcher(httpClient);
        FixtureFetcher fixture = new FixtureFetcher();

        return new FetcherRegistry()
                .register("file", filesystem)
                .register("local", filesystem)
                .register("pvc", filesystem)
                .register("s3", objectStorage)
                .register("http", http)
                .register("https", http)
                .register("git", git)
                .register("git+https", git)
                .register("git+http", git)
                .register("git+ssh", git)
                .register("mock", fixture)
                .register("fixture", fixture);
    }

    @Override
    public void close() {
        Set<Object> closed = new LinkedHashSet<>();
        for (DocumentFetcher fetcher : fetchers.values()) {
            if (fetcher instanceof AutoCloseable && closed.add(fetcher)) {
                try {
                    ((AutoCloseable) fetcher).close();
                } catch (Exception e) {
                    log.warn("Failed to close fetcher={} cause={}", fetcher.getClass().getSimpleName(), e.getMessage());
                }
            }
        }
    }
}
