package com.ragingest.index;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface IndexStore {
    String collectionName();

    void ensureCollection(int dimension);

    void upsert(List<Point> points);

    Optional<CollectionInfo> getCollectionInfo();

    void applyIndexParameters(String indexType, Map<String, String> parameters);

    void createAlias(String alias, String collection);

    void switchAlias(String alias, String collection);

    List<AliasBinding> listAliases();

    boolean healthCheck();
}
