package com.ragingest.source;

public class SourceException extends Exception {
    public enum Kind {
        SOURCE_NOT_FOUND,
        SOURCE_UNREACHABLE,
        UNSUPPORTED_SOURCE_KIND
    }

    private final Kind kind;

    public SourceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SourceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
