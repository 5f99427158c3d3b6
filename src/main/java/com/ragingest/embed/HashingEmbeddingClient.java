package com.ragingest.embed;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class HashingEmbeddingClient implements EmbeddingClient {
    private static final String MODEL = "local-hash-v1";
    private final int dimension;

    public HashingEmbeddingClient(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String model() {
        return MODEL;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
        }
        normalize(vector);
        return vector;
    }

    private static void addHashed(float[] vector, String key, float weight) {
        vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
    }

    private static void normalize(float[] vector) {
        double norm = 0d;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm <= 0d) {
            return;
        }
        float scale = (float) (1d / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
    }
}
