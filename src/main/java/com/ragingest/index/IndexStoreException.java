package com.ragingest.index;

public class IndexStoreException extends RuntimeException {
    public enum Kind {
        COLLECTION_NOT_FOUND,
        DIMENSION_MISMATCH,
        UPSERT_FAILED,
        ALIAS_NOT_FOUND,
        UNAVAILABLE,
        REQUEST_FAILED
    }

    private final Kind kind;

    public IndexStoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public IndexStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
