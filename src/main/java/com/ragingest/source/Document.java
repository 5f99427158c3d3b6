package com.ragingest.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Document(String id, String text, Map<String, Object> metadata) {

    public Document {
        Objects.requireNonNull(id, "id");
        text = text == null ? "" : text;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Document withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new Document(id, text, merged);
    }

    public String extension() {
        Object extension = metadata.get("extension");
        return extension == null ? "" : extension.toString();
    }
}
