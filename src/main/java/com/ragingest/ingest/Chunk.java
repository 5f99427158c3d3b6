package com.ragingest.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Chunk(
        String id,
        String docId,
        int chunkIndex,
        int totalChunks,
        String text,
        Map<String, Object> metadata) {

    public Chunk {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static String idFor(String docId, int chunkIndex) {
        return docId + "_chunk_" + chunkIndex;
    }
}
