package com.ragingest.embed;

import java.util.List;

public interface EmbeddingClient {
    List<float[]> embed(List<String> texts);

    int dimension();

    String model();
}
