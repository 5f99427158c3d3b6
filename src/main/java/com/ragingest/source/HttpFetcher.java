package com.ragingest.source;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpFetcher implements DocumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);

    private final OkHttpClient httpClient;

    public HttpFetcher(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public List<Document> fetch(String uri) throws SourceException {
        HttpUrl url = HttpUrl.parse(uri);
        if (url == null) {
            throw new SourceException(SourceException.Kind.SOURCE_NOT_FOUND, "Invalid URL: " + uri);
        }

        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                throw new SourceException(SourceException.Kind.SOURCE_NOT_FOUND, "HTTP 404 for " + uri);
            }
            if (!response.isSuccessful()) {
                throw new SourceException(SourceException.Kind.SOURCE_UNREACHABLE, "HTTP " + response.code() + " for " + uri);
            }
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();

            String name = documentName(url);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", uri);
            metadata.put("content_type", headerOrEmpty(response, "Content-Type"));
            metadata.put("content_length", headerOrEmpty(response, "Content-Length"));
            metadata.put("extension", SourceFiles.extensionOf(name));
            log.info("Fetched url={} status={} chars={}", uri, response.code(), text.length());
            return List.of(new Document(name, text, metadata));
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.SOURCE_UNREACHABLE, "Failed to fetch " + uri + ": " + e.getMessage(), e);
        }
    }

    private static String documentName(HttpUrl url) {
        List<String> segments = url.pathSegments();
        for (int i = segments.size() - 1; i >= 0; i--) {
            if (!segments.get(i).isBlank()) {
                return segments.get(i);
            }
        }
        return url.host();
    }

    private static String headerOrEmpty(Response response, String name) {
        String value = response.header(name);
        return value == null ? "" : value;
    }
}
