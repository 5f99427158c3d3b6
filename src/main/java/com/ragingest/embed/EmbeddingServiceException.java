package com.ragingest.embed;

public class EmbeddingServiceException extends RuntimeException {
    public enum Kind {
        RATE_LIMITED,
        SERVICE_UNAVAILABLE,
        INVALID_REQUEST,
        NOT_CONFIGURED;

        public static Kind from(FailureKind failureKind) {
            if (failureKind == FailureKind.RATE_LIMITED) {
                return RATE_LIMITED;
            }
            if (failureKind == FailureKind.INVALID_REQUEST) {
                return INVALID_REQUEST;
            }
            if (failureKind == FailureKind.NOT_CONFIGURED) {
                return NOT_CONFIGURED;
            }
            return SERVICE_UNAVAILABLE;
        }
    }

    private final Kind kind;

    public EmbeddingServiceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EmbeddingServiceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
