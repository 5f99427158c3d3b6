package com.ragingest.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Point(String id, float[] vector, Map<String, Object> payload) {

    public Point {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
