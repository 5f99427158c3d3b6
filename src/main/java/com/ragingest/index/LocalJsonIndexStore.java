package com.ragingest.index;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

public class LocalJsonIndexStore implements IndexStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonIndexStore.class);

    private final Path storePath;
    private final String collection;
    private final ObjectMapper mapper = new ObjectMapper();

    public LocalJsonIndexStore(Path storePath, String collection) {
        this.storePath = storePath;
        this.collection = collection;
    }

    @Override
    public String collectionName() {
        return collection;
    }

    @Override
    public synchronized void ensureCollection(int dimension) {
        StoreState state = load();
        StoredCollection existing = state.collections.get(collection);
        if (existing != null) {
            if (existing.dimension != dimension) {
                throw new IndexStoreException(IndexStoreException.Kind.DIMENSION_MISMATCH,
                        "Collection " + collection + " has dimension " + existing.dimension + " but embeddings have " + dimension);
            }
            log.info("Collection {} already exists dimension={} vectors={}", collection, dimension, existing.points.size());
            return;
        }
        StoredCollection created = new StoredCollection();
        created.dimension = dimension;
        state.collections.put(collection, created);
        save(state, IndexStoreException.Kind.REQUEST_FAILED);
        log.info("Created collection {} dimension={} path={}", collection, dimension, storePath);
    }

    @Override
    public synchronized void upsert(List<Point> points) {
        if (points.isEmpty()) {
            return;
        }
        StoreState state = load();
        StoredCollection target = requireCollection(state, collection);
        for (Point point : points) {
            if (point.vector().length != target.dimension) {
                throw new IndexStoreException(IndexStoreException.Kind.UPSERT_FAILED,
                        "Point " + point.id() + " has dimension " + point.vector().length + ", collection " + collection
                                + " expects " + target.dimension);
            }
        }
        for (Point point : points) {
            StoredPoint stored = new StoredPoint();
            stored.vector = point.vector();
            stored.payload = new LinkedHashMap<>(point.payload());
            target.points.put(point.id(), stored);
        }
        save(state, IndexStoreException.Kind.UPSERT_FAILED);
    }

    @Override
    public synchronized Optional<CollectionInfo> getCollectionInfo() {
        StoredCollection stored = load().collections.get(collection);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.of(new CollectionInfo(collection, stored.points.size(), CollectionInfo.READY_STATUS, stored.dimension));
    }

    @Override
    public synchronized void applyIndexParameters(String indexType, Map<String, String> parameters) {
        StoreState state = load();
        StoredCollection target = requireCollection(state, collection);
        target.indexType = indexType;
        target.indexParameters = new LinkedHashMap<>(parameters);
        save(state, IndexStoreException.Kind.REQUEST_FAILED);
        log.info("Recorded index parameters collection={} type={} params={}", collection, indexType, parameters);
    }

    @Override
    public synchronized void createAlias(String alias, String targetCollection) {
        StoreState state = load();
        requireCollection(state, targetCollection);
        state.aliases.put(alias, targetCollection);
        save(state, IndexStoreException.Kind.REQUEST_FAILED);
        log.info("Created alias {} -> {}", alias, targetCollection);
    }

    @Override
    public synchronized void switchAlias(String alias, String targetCollection) {
        StoreState state = load();
        requireCollection(state, targetCollection);
        String previous = state.aliases.put(alias, targetCollection);
        save(state, IndexStoreException.Kind.REQUEST_FAILED);
        log.info("Switched alias {} from {} to {}", alias, previous == null ? "<none>" : previous, targetCollection);
    }

    @Override
    public synchronized List<AliasBinding> listAliases() {
        List<AliasBinding> aliases = new ArrayList<>();
        for (Map.Entry<String, String> entry : load().aliases.entrySet()) {
            if (entry.getValue().equals(collection)) {
                aliases.add(new AliasBinding(entry.getKey(), entry.getValue()));
            }
        }
        return aliases;
    }

    @Override
    public boolean healthCheck() {
        try {
            load();
            return true;
        } catch (IndexStoreException e) {
            log.error("Local index store unreadable path={} cause={}", storePath, e.getMessage());
            return false;
        }
    }

    public Optional<Map<String, Object>> payloadOf(String pointId) {
        StoredCollection stored = load().collections.get(collection);
        if (stored == null || !stored.points.containsKey(pointId)) {
            return Optional.empty();
        }
        return Optional.of(stored.points.get(pointId).payload);
    }

    private StoredCollection requireCollection(StoreState state, String name) {
        StoredCollection stored = state.collections.get(name);
        if (stored == null) {
            throw new IndexStoreException(IndexStoreException.Kind.COLLECTION_NOT_FOUND, "Collection " + name + " not found");
        }
        return stored;
    }

    private StoreState load() {
        if (!Files.exists(storePath)) {
            return new StoreState();
        }
        try {
            return mapper.readValue(storePath.toFile(), StoreState.class);
        } catch (IOException e) {
            throw new IndexStoreException(IndexStoreException.Kind.UNAVAILABLE, "Cannot read index store " + storePath + ": " + e.getMessage(), e);
        }
    }

    private void save(StoreState state, IndexStoreException.Kind failureKind) {
        try {
            Path parent = storePath.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, storePath.getFileName().toString(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            try {
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IndexStoreException(failureKind, "Cannot write index store " + storePath + ": " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StoreState {
        public Map<String, StoredCollection> collections = new LinkedHashMap<>();
        public Map<String, String> aliases = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StoredCollection {
        public int dimension;
        public String indexType = "";
        public Map<String, String> indexParameters = new LinkedHashMap<>();
        public Map<String, StoredPoint> points = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StoredPoint {
        public float[] vector = new float[0];
        public Map<String, Object> payload = new LinkedHashMap<>();
    }
}
