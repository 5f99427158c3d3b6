package com.ragingest.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobKind {
    EMBEDDING_JOB("EmbeddingJob", "embeddingjobs", "processedChunks", "totalChunks"),
    INDEX_JOB("IndexJob", "indexjobs", "indexedVectors", "totalVectors");

    private final String resourceKind;
    private final String plural;
    private final String processedField;
    private final String totalField;

    JobKind(String resourceKind, String plural, String processedField, String totalField) {
        this.resourceKind = resourceKind;
        this.plural = plural;
        this.processedField = processedField;
        this.totalField = totalField;
    }

    @JsonValue
    public String resourceKind() {
        return resourceKind;
    }

    public String plural() {
        return plural;
    }

    public String processedField() {
        return processedField;
    }

    public String totalField() {
        return totalField;
    }
}
