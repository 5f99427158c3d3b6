package com.ragingest.source;

import java.util.List;

@FunctionalInterface
public interface DocumentFetcher {
    List<Document> fetch(String uri) throws SourceException;
}
