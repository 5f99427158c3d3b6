package com.ragingest.job;

public record IngestionReport(
        String documentSet,
        String collection,
        int documents,
        long totalChunks,
        long processedChunks,
        int batches) {
}
