package com.ragingest.job;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragingest.embed.EmbeddingClient;
import com.ragingest.embed.EmbeddingServiceException;
import com.ragingest.embed.HashingEmbeddingClient;
import com.ragingest.index.IndexStoreException;
import com.ragingest.index.Point;
import com.ragingest.index.PointIds;
import com.ragingest.runtime.AppConfig;
import com.ragingest.source.Document;
import com.ragingest.source.FetcherRegistry;
import com.ragingest.source.FilesystemFetcher;
import com.ragingest.source.FixtureFetcher;
import com.ragingest.source.SourceException;
import com.ragingest.status.JobKind;
import com.ragingest.status.JobPhase;
import com.ragingest.status.JobStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionJobTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldIngestShortAndLongDocumentsEndToEnd() throws Exception {
        Files.writeString(tempDir.resolve("short.txt"), "x".repeat(50));
        Files.writeString(tempDir.resolve("long.txt"), "Vector search ranks passages by similarity. ".repeat(114).substring(0, 5000));
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        RecordingStatusReporter reporter = new RecordingStatusReporter();
        FetcherRegistry fetchers = new FetcherRegistry().register("file", new FilesystemFetcher());

        IngestionReport report = new IngestionJob(config(tempDir.toString(), 16), fetchers, new HashingEmbeddingClient(8), store, reporter)
                .run("docs-set");

        assertEquals(2, report.documents());
        assertTrue(report.totalChunks() >= 10, "expected 1 + >=9 chunks, got " + report.totalChunks());
        assertEquals(report.totalChunks(), report.processedChunks());
        assertEquals(report.totalChunks(), store.points.size());
        assertEquals("ensureCollection 8", store.calls.get(0));
        assertTrue(store.points.containsKey(PointIds.forChunk("short.txt", "short.txt_chunk_0")));

        JobStatus last = reporter.last();
        assertEquals(JobKind.EMBEDDING_JOB, last.kind());
        assertEquals("docs-set", last.name());
        assertEquals(JobPhase.SUCCEEDED, last.phase());
        assertEquals(last.progress().total(), last.progress().processed());
        assertEquals(100, last.progress().percentage());
        assertEquals(List.of(JobPhase.PENDING, JobPhase.RUNNING, JobPhase.SUCCEEDED), reporter.phases());
        assertProcessedNeverDecreases(reporter.statuses);
    }

    @Test
    void shouldWritePointPayloadWithLineage() throws Exception {
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        FetcherRegistry fetchers = new FetcherRegistry().register("mock", new FixtureFetcher(List.of(
                new Document("faq", "What is an alias? A pointer to a collection.", Map.of("topic", "qdrant")))));

        new IngestionJob(config("mock://fixture", 16), fetchers, new HashingEmbeddingClient(4), store, new RecordingStatusReporter())
                .run("faq-set");

        Point point = store.points.get(PointIds.forChunk("faq", "faq_chunk_0"));
        assertEquals("What is an alias? A pointer to a collection.", point.payload().get("text"));
        assertEquals("faq", point.payload().get("doc_id"));
        assertEquals(0, point.payload().get("chunk_index"));
        Map<?, ?> metadata = (Map<?, ?>) point.payload().get("metadata");
        assertEquals("qdrant", metadata.get("topic"));
        assertEquals(1, metadata.get("total_chunks"));
    }

    @Test
    void shouldBeIdempotentWhenRerunWithSameInput() throws Exception {
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        FetcherRegistry fetchers = new FetcherRegistry().register("mock", new FixtureFetcher());
        IngestionJob job = new IngestionJob(config("mock://", 2), fetchers, new HashingEmbeddingClient(4), store, new RecordingStatusReporter());

        long first = job.run("fixture").totalChunks();
        job.run("fixture");

        assertEquals(first, store.points.size());
    }

    @Test
    void shouldFailWithoutTouchingIndexWhenSourceIsEmpty() {
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        RecordingStatusReporter reporter = new RecordingStatusReporter();
        FetcherRegistry fetchers = new FetcherRegistry().register("mock", new FixtureFetcher(List.of()));

        JobFailedException error = assertThrows(JobFailedException.class,
                () -> new IngestionJob(config("mock://empty", 16), fetchers, new HashingEmbeddingClient(4), store, reporter).run("empty"));

        assertInstanceOf(SourceException.class, error.getCause());
        assertTrue(store.calls.isEmpty());
        assertEquals(JobPhase.FAILED, reporter.last().phase());
    }

    @Test
    void shouldFailWithoutTouchingIndexWhenDocumentsHaveNoText() {
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        FetcherRegistry fetchers = new FetcherRegistry().register("mock", new FixtureFetcher(List.of(
                new Document("blank", "   ", Map.of()))));

        assertThrows(JobFailedException.class,
                () -> new IngestionJob(config("mock://blank", 16), fetchers, new HashingEmbeddingClient(4), store,
                        new RecordingStatusReporter()).run("blank"));

        assertTrue(store.calls.isEmpty());
    }

    @Test
    void shouldRejectInvalidConfigurationBeforeAnySideEffect() {
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        RecordingStatusReporter reporter = new RecordingStatusReporter();
        AppConfig.IngestionConfig config = config("mock://", 16);
        config.setChunkOverlap(512);

        JobConfigurationException error = assertThrows(JobConfigurationException.class,
                () -> new IngestionJob(config, new FetcherRegistry(), new HashingEmbeddingClient(4), store, reporter).run("docs"));

        assertTrue(error.getMessage().contains("overlap"));
        assertTrue(store.calls.isEmpty());
        assertEquals(List.of(JobPhase.FAILED), reporter.phases());
    }

    @Test
    void shouldRequireCollectionName() {
        assertThrows(JobConfigurationException.class,
                () -> new IngestionJob(config("mock://", 16), new FetcherRegistry(), new HashingEmbeddingClient(4),
                        new InMemoryIndexStore(""), new RecordingStatusReporter()).run("docs"));
    }

    @Test
    void shouldFailOnDimensionMismatchBetweenEmbeddingsAndCollection() {
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        FetcherRegistry fetchers = new FetcherRegistry().register("mock", new FixtureFetcher());
        EmbeddingClient lying = new EmbeddingClient() {
            @Override
            public List<float[]> embed(List<String> texts) {
                List<float[]> vectors = new ArrayList<>();
                texts.forEach(text -> vectors.add(new float[3]));
                return vectors;
            }

            @Override
            public int dimension() {
                return 4;
            }

            @Override
            public String model() {
                return "lying";
            }
        };

        JobFailedException error = assertThrows(JobFailedException.class,
                () -> new IngestionJob(config("mock://", 16), fetchers, lying, store, new RecordingStatusReporter()).run("docs"));

        IndexStoreException cause = assertInstanceOf(IndexStoreException.class, error.getCause());
        assertEquals(IndexStoreException.Kind.DIMENSION_MISMATCH, cause.kind());
        assertTrue(store.points.isEmpty());
    }

    @Test
    void shouldKeepCommittedBatchesWhenLaterBatchFails() {
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        store.upsertFailure = new IndexStoreException(IndexStoreException.Kind.UPSERT_FAILED, "disk full");
        store.failUpsertAfterBatches = 1;
        RecordingStatusReporter reporter = new RecordingStatusReporter();
        FetcherRegistry fetchers = new FetcherRegistry().register("mock", new FixtureFetcher());

        assertThrows(JobFailedException.class,
                () -> new IngestionJob(config("mock://", 1), fetchers, new HashingEmbeddingClient(4), store, reporter).run("docs"));

        assertEquals(1, store.points.size());
        JobStatus last = reporter.last();
        assertEquals(JobPhase.FAILED, last.phase());
        assertEquals(1, last.progress().processed());
        assertTrue(last.message().contains("disk full"));
    }

    @Test
    void shouldReportEmbeddingFailures() {
        InMemoryIndexStore store = new InMemoryIndexStore("docs");
        FetcherRegistry fetchers = new FetcherRegistry().register("mock", new FixtureFetcher());
        EmbeddingClient unavailable = new HashingEmbeddingClient(4) {
            @Override
            public List<float[]> embed(List<String> texts) {
                throw new EmbeddingServiceException(EmbeddingServiceException.Kind.RATE_LIMITED, "rate limited after 4 attempts");
            }
        };

        JobFailedException error = assertThrows(JobFailedException.class,
                () -> new IngestionJob(config("mock://", 16), fetchers, unavailable, store, new RecordingStatusReporter()).run("docs"));

        assertInstanceOf(EmbeddingServiceException.class, error.getCause());
        assertEquals(List.of("ensureCollection 4"), store.calls);
    }

    private static void assertProcessedNeverDecreases(List<JobStatus> statuses) {
        long previous = 0;
        for (JobStatus status : statuses) {
            assertTrue(status.progress().processed() >= previous);
            previous = status.progress().processed();
        }
    }

    private static AppConfig.IngestionConfig config(String sourceUri, int batchSize) {
        AppConfig.IngestionConfig config = new AppConfig.IngestionConfig();
        config.setSourceUri(sourceUri);
        config.setBatchSize(batchSize);
        return config;
    }
}
