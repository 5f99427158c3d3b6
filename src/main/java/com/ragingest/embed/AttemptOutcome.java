package com.ragingest.embed;

public record AttemptOutcome<T>(T value, FailureKind failureKind, Exception failure) {

    public static <T> AttemptOutcome<T> success(T value) {
        return new AttemptOutcome<>(value, null, null);
    }

    public static <T> AttemptOutcome<T> failure(FailureKind failureKind, Exception failure) {
        return new AttemptOutcome<>(null, failureKind, failure);
    }

    public boolean succeeded() {
        return failureKind == null;
    }
}
