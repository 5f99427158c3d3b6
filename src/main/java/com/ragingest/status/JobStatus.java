package com.ragingest.status;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatus(
        JobKind kind,
        String name,
        JobPhase phase,
        String message,
        JobProgress progress,
        Boolean aliasSwapped,
        Instant timestamp) {

    public static JobStatus of(JobKind kind, String name, JobPhase phase, String message, JobProgress progress) {
        return new JobStatus(kind, name, phase, message, progress, null, Instant.now());
    }

    public JobStatus withAliasSwapped(boolean swapped) {
        return new JobStatus(kind, name, phase, message, progress, swapped, timestamp);
    }
}
