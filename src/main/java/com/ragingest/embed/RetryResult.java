package com.ragingest.embed;

public record RetryResult<T>(AttemptOutcome<T> lastOutcome, int attempts, boolean interrupted) {

    public boolean succeeded() {
        return lastOutcome.succeeded();
    }

    public T value() {
        return lastOutcome.value();
    }

    public FailureKind failureKind() {
        return lastOutcome.failureKind();
    }

    public Exception failure() {
        return lastOutcome.failure();
    }

    public String failureMessage() {
        Exception failure = lastOutcome.failure();
        String detail = failure == null ? String.valueOf(lastOutcome.failureKind()) : failure.getMessage();
        return (interrupted ? "interrupted" : "failed") + " after " + attempts + " attempt(s): " + detail;
    }
}
