package com.ragingest.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobPhase {
    PENDING("Pending"),
    RUNNING("Running"),
    BUILDING("Building"),
    OPTIMIZING("Optimizing"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed");

    private final String label;

    JobPhase(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
