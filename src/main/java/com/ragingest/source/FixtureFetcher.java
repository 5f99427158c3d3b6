package com.ragingest.source;

import java.util.List;
import java.util.Map;

public class FixtureFetcher implements DocumentFetcher {
    private final List<Document> documents;

    public FixtureFetcher() {
        this(sampleDocuments());
    }

    public FixtureFetcher(List<Document> documents) {
        this.documents = List.copyOf(documents);
    }

    @Override
    public List<Document> fetch(String uri) {
        return documents;
    }

    static List<Document> sampleDocuments() {
        return List.of(
                new Document("vector-databases",
                        "Qdrant is a vector similarity search engine. It stores points made of a vector and a JSON "
                                + "payload, and serves nearest-neighbour queries over collections.\n\n"
                                + "Collections are configured with a vector size and a distance metric such as cosine. "
                                + "An HNSW graph index keeps queries fast as the collection grows.",
                        Map.of("source", "fixture", "topic", "vector-databases", "extension", ".txt")),
                new Document("retrieval-augmented-generation",
                        "Retrieval-augmented generation combines a language model with a document index. Relevant "
                                + "passages are retrieved for each question and passed to the model as context.\n\n"
                                + "Documents are split into overlapping chunks before embedding so that each passage "
                                + "fits the embedding model and keeps enough surrounding context.",
                        Map.of("source", "fixture", "topic", "rag", "extension", ".txt")),
                new Document("kubernetes-jobs",
                        "Kubernetes runs batch work as Jobs. A Job creates pods that run to completion and records "
                                + "whether they succeeded.\n\n"
                                + "Operators watch custom resources and reconcile them by creating Jobs, then publish "
                                + "progress through the status subresource of the custom resource.",
                        Map.of("source", "fixture", "topic", "kubernetes", "extension", ".txt")));
    }
}
