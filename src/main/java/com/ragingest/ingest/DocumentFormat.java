package com.ragingest.ingest;

import java.util.Locale;

import com.ragingest.source.Document;

public enum DocumentFormat {
    TEXT,
    MARKDOWN,
    HTML,
    AUTO;

    public static DocumentFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported document format: " + value, e);
        }
    }

    public DocumentFormat resolve(Document document) {
        if (this != AUTO) {
            return this;
        }
        String extension = document.extension();
        if (extension.equals(".md") || extension.equals(".markdown")) {
            return MARKDOWN;
        }
        if (extension.equals(".html") || extension.equals(".htm")) {
            return HTML;
        }
        Object contentType = document.metadata().get("content_type");
        if (contentType != null && contentType.toString().toLowerCase(Locale.ROOT).startsWith("text/html")) {
            return HTML;
        }
        return TEXT;
    }
}
