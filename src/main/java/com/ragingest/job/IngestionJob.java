package com.ragingest.job;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragingest.embed.EmbeddingClient;
import com.ragingest.index.IndexStore;
import com.ragingest.index.IndexStoreException;
import com.ragingest.index.Point;
import com.ragingest.index.PointIds;
import com.ragingest.ingest.Chunk;
import com.ragingest.ingest.DocumentFormat;
import com.ragingest.ingest.DocumentProcessor;
import com.ragingest.ingest.TextChunker;
import com.ragingest.runtime.AppConfig;
import com.ragingest.source.Document;
import com.ragingest.source.FetcherRegistry;
import com.ragingest.source.SourceException;
import com.ragingest.status.JobKind;
import com.ragingest.status.JobPhase;
import com.ragingest.status.JobProgress;
import com.ragingest.status.JobStatus;
import com.ragingest.status.StatusReporter;

public class IngestionJob {
    private static final Logger log = LoggerFactory.getLogger(IngestionJob.class);

    private final AppConfig.IngestionConfig config;
    private final FetcherRegistry fetchers;
    private final EmbeddingClient embeddingClient;
    private final IndexStore indexStore;
    private final StatusReporter statusReporter;

    public IngestionJob(AppConfig.IngestionConfig config,
            FetcherRegistry fetchers,
            EmbeddingClient embeddingClient,
            IndexStore indexStore,
            StatusReporter statusReporter) {
        this.config = config;
        this.fetchers = fetchers;
        this.embeddingClient = embeddingClient;
        this.indexStore = indexStore;
        this.statusReporter = statusReporter;
    }

    public IngestionReport run(String documentSetId) throws JobFailedException {
        String name = documentSetId == null || documentSetId.isBlank() ? config.getDocumentSet() : documentSetId;
        DocumentFormat format;
        try {
            format = validate(name);
        } catch (JobConfigurationException e) {
            report(name, JobPhase.FAILED, "Invalid configuration: " + e.getMessage(), JobProgress.NONE);
            throw e;
        }

        String collection = indexStore.collectionName();
        long total = 0;
        long processed = 0;
        report(name, JobPhase.PENDING, "Starting embedding job", JobProgress.NONE);
        try {
            report(name, JobPhase.RUNNING, "Fetching documents from " + config.getSourceUri(), JobProgress.NONE);
            List<Document> documents = fetchers.resolve(config.getSourceType(), config.getSourceUri())
                    .fetch(config.getSourceUri());
            if (documents.isEmpty()) {
                throw new SourceException(SourceException.Kind.SOURCE_NOT_FOUND,
                        "Source " + config.getSourceUri() + " produced no documents");
            }

            DocumentProcessor processor = new DocumentProcessor(
                    new TextChunker(config.getChunkSize(), config.getChunkOverlap()), format);
            List<Chunk> chunks = processor.process(documents);
            if (chunks.isEmpty()) {
                throw new IllegalStateException(documents.size() + " documents produced no chunks");
            }
            total = chunks.size();
            report(name, JobPhase.RUNNING,
                    "Chunked " + documents.size() + " documents into " + total + " chunks",
                    JobProgress.of(total, 0));

            int dimension = embeddingClient.dimension();
            indexStore.ensureCollection(dimension);

            int batches = 0;
            for (int start = 0; start < chunks.size(); start += config.getBatchSize()) {
                List<Chunk> batch = chunks.subList(start, Math.min(start + config.getBatchSize(), chunks.size()));
                indexStore.upsert(toPoints(batch, embed(batch), dimension));
                batches++;
                processed += batch.size();
                report(name, JobPhase.RUNNING,
                        "Processed " + processed + "/" + total + " chunks",
                        JobProgress.of(total, processed));
            }

            report(name, JobPhase.SUCCEEDED,
                    "Indexed " + processed + " chunks from " + documents.size() + " documents into " + collection,
                    JobProgress.of(total, processed));
            return new IngestionReport(name, collection, documents.size(), total, processed, batches);
        } catch (Exception e) {
            log.error("Embedding job {} failed: {}", name, e.getMessage(), e);
            report(name, JobPhase.FAILED, "Error: " + e.getMessage(), JobProgress.of(total, processed));
            throw new JobFailedException("Embedding job " + name + " failed: " + e.getMessage(), e);
        }
    }

    private DocumentFormat validate(String name) {
        if (name == null || name.isBlank()) {
            throw new JobConfigurationException("document set name is required");
        }
        if (config.getSourceUri().isBlank()) {
            throw new JobConfigurationException("source URI is required");
        }
        if (indexStore.collectionName() == null || indexStore.collectionName().isBlank()) {
            throw new JobConfigurationException("target collection is required");
        }
        if (config.getChunkSize() <= 0) {
            throw new JobConfigurationException("chunk size must be > 0, got " + config.getChunkSize());
        }
        if (config.getChunkOverlap() < 0 || config.getChunkOverlap() >= config.getChunkSize()) {
            throw new JobConfigurationException("chunk overlap must be in [0, " + config.getChunkSize()
                    + "), got " + config.getChunkOverlap());
        }
        if (config.getBatchSize() <= 0) {
            throw new JobConfigurationException("batch size must be > 0, got " + config.getBatchSize());
        }
        try {
            return DocumentFormat.parse(config.getFormat());
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException(e.getMessage());
        }
    }

    private List<float[]> embed(List<Chunk> batch) {
        List<String> texts = new ArrayList<>(batch.size());
        for (Chunk chunk : batch) {
            texts.add(chunk.text());
        }
        List<float[]> vectors = embeddingClient.embed(texts);
        if (vectors.size() != batch.size()) {
            throw new IllegalStateException("Embedding client returned " + vectors.size()
                    + " vectors for " + batch.size() + " chunks");
        }
        return vectors;
    }

    private static List<Point> toPoints(List<Chunk> batch, List<float[]> vectors, int dimension) {
        List<Point> points = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Chunk chunk = batch.get(i);
            float[] vector = vectors.get(i);
            if (vector.length != dimension) {
                throw new IndexStoreException(IndexStoreException.Kind.DIMENSION_MISMATCH,
                        "Chunk " + chunk.id() + " embedded to dimension " + vector.length + ", collection expects " + dimension);
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("text", chunk.text());
            payload.put("metadata", chunk.metadata());
            payload.put("doc_id", chunk.docId());
            payload.put("chunk_index", chunk.chunkIndex());
            points.add(new Point(PointIds.forChunk(chunk.docId(), chunk.id()), vector, payload));
        }
        return points;
    }

    private void report(String name, JobPhase phase, String message, JobProgress progress) {
        statusReporter.report(JobStatus.of(JobKind.EMBEDDING_JOB, name, phase, message, progress));
    }
}
