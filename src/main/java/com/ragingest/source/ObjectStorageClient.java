package com.ragingest.source;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

public interface ObjectStorageClient extends AutoCloseable {
    List<StorageObject> list(String bucket, String prefix) throws IOException;

    byte[] read(String bucket, String key) throws IOException;

    @Override
    default void close() {
        // no-op
    }

    record StorageObject(String key, long size, Instant lastModified) {
    }
}
