package com.ragingest.source;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ObjectStorageFetcher implements DocumentFetcher, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ObjectStorageFetcher.class);

    private final ObjectStorageClient storage;
    private final List<String> extensions;

    public ObjectStorageFetcher(ObjectStorageClient storage) {
        this(storage, SourceFiles.SUPPORTED_EXTENSIONS);
    }

    public ObjectStorageFetcher(ObjectStorageClient storage, List<String> extensions) {
        this.storage = storage;
        this.extensions = List.copyOf(extensions);
    }

    @Override
    public List<Document> fetch(String uri) throws SourceException {
        String location = uri.startsWith("s3://") ? uri.substring("s3://".length()) : uri;
        int slash = location.indexOf('/');
        String bucket = slash < 0 ? location : location.substring(0, slash);
        String prefix = slash < 0 ? "" : location.substring(slash + 1);
        if (bucket.isBlank()) {
            throw new SourceException(SourceException.Kind.SOURCE_NOT_FOUND, "Object storage URI has no bucket: " + uri);
        }

        List<ObjectStorageClient.StorageObject> objects;
        try {
            objects = storage.list(bucket, prefix);
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.SOURCE_UNREACHABLE, e.getMessage(), e);
        }

        List<Document> documents = new ArrayList<>();
        for (ObjectStorageClient.StorageObject object : objects) {
            if (object.key().endsWith("/") || !SourceFiles.isSupported(object.key(), extensions)) {
                continue;
            }
            try {
                String text = SourceFiles.decode(storage.read(bucket, object.key()));
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("source", "s3://" + bucket + "/" + object.key());
                metadata.put("bucket", bucket);
                metadata.put("key", object.key());
                metadata.put("size", object.size());
                metadata.put("last_modified", object.lastModified() == null ? "" : object.lastModified().toString());
                metadata.put("extension", SourceFiles.extensionOf(object.key()));
                documents.add(new Document(object.key(), text, metadata));
            } catch (IOException e) {
                log.warn("Skipping object bucket={} key={} cause={}", bucket, object.key(), e.getMessage());
            }
        }

        if (documents.isEmpty()) {
            throw new SourceException(SourceException.Kind.SOURCE_NOT_FOUND, "No supported documents found under " + uri);
        }
        log.info("Fetched {} documents from bucket={} prefix={}", documents.size(), bucket, prefix);
        return documents;
    }

    @Override
    public void close() {
        storage.close();
    }
}
