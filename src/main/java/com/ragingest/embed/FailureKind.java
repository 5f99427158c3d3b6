package com.ragingest.embed;

public enum FailureKind {
    RATE_LIMITED(true),
    TRANSIENT(true),
    SERVER_ERROR(true),
    INVALID_REQUEST(false),
    NOT_CONFIGURED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    public static FailureKind fromHttpStatus(int statusCode) {
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        if (statusCode == 408) {
            return TRANSIENT;
        }
        return INVALID_REQUEST;
    }
}
