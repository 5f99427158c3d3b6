package com.ragingest.index;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

public final class PointIds {
    private PointIds() {
    }

    /**
     * Name-based UUID for a chunk, stable across runs so re-ingesting the same chunk overwrites its point.
     */
    public static String forChunk(String docId, String chunkId) {
        return UUID.nameUUIDFromBytes((docId + ":" + chunkId).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
