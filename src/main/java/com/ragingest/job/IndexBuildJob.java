package com.ragingest.job;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragingest.embed.Sleeper;
import com.ragingest.index.CollectionInfo;
import com.ragingest.index.IndexStore;
import com.ragingest.index.IndexStoreException;
import com.ragingest.runtime.AppConfig;
import com.ragingest.status.JobKind;
import com.ragingest.status.JobPhase;
import com.ragingest.status.JobProgress;
import com.ragingest.status.JobStatus;
import com.ragingest.status.StatusReporter;

public class IndexBuildJob {
    private static final Logger log = LoggerFactory.getLogger(IndexBuildJob.class);

    private final AppConfig.IndexConfig config;
    private final IndexStore indexStore;
    private final StatusReporter statusReporter;
    private final Sleeper sleeper;

    public IndexBuildJob(AppConfig.IndexConfig config, IndexStore indexStore, StatusReporter statusReporter) {
        this(config, indexStore, statusReporter, Sleeper.SYSTEM);
    }

    IndexBuildJob(AppConfig.IndexConfig config, IndexStore indexStore, StatusReporter statusReporter, Sleeper sleeper) {
        this.config = config;
        this.indexStore = indexStore;
        this.statusReporter = statusReporter;
        this.sleeper = sleeper;
    }

    public IndexBuildReport run(String indexId) throws JobFailedException {
        String collection = indexStore.collectionName();
        String name = indexId == null || indexId.isBlank() ? defaultName(collection) : indexId;
        try {
            validate(collection);
        } catch (JobConfigurationException e) {
            report(name, JobPhase.FAILED, "Invalid configuration: " + e.getMessage(), JobProgress.NONE, null);
            throw e;
        }

        long total = 0;
        report(name, JobPhase.BUILDING, "Starting index build for collection " + collection, JobProgress.NONE, null);
        try {
            CollectionInfo info = indexStore.getCollectionInfo()
                    .orElseThrow(() -> new IndexStoreException(IndexStoreException.Kind.COLLECTION_NOT_FOUND,
                            "Collection " + collection + " not found"));
            total = info.vectorCount();
            report(name, JobPhase.BUILDING, "Found " + total + " vectors, optimizing index", JobProgress.of(total, 0), null);

            applyParameters();
            CollectionInfo settled = awaitReady(info);
            total = settled.vectorCount();
            report(name, JobPhase.OPTIMIZING,
                    settled.isReady() ? "Index built, switching alias" : "Index still optimizing, switching alias",
                    JobProgress.of(total, total), null);

            boolean swapped = swapAlias(collection);
            String message = "Index ready with " + total + " vectors"
                    + (swapped ? ", alias " + config.getTargetAlias() + " -> " + collection : "");
            report(name, JobPhase.SUCCEEDED, message, JobProgress.of(total, total), swapped);
            return new IndexBuildReport(name, collection, total, settled.isReady(), config.getTargetAlias(), swapped);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Index job {} interrupted while waiting for collection {}", name, collection, e);
            report(name, JobPhase.FAILED, "Error: interrupted while waiting for index", JobProgress.of(total, 0), false);
            throw new JobFailedException("Index job " + name + " interrupted", e);
        } catch (RuntimeException e) {
            log.error("Index job {} failed: {}", name, e.getMessage(), e);
            report(name, JobPhase.FAILED, "Error: " + e.getMessage(), JobProgress.of(total, 0), false);
            throw new JobFailedException("Index job " + name + " failed: " + e.getMessage(), e);
        }
    }

    private void validate(String collection) {
        if (collection == null || collection.isBlank()) {
            throw new JobConfigurationException("target collection is required");
        }
        if (config.getPollIntervalMs() <= 0) {
            throw new JobConfigurationException("poll interval must be > 0, got " + config.getPollIntervalMs());
        }
        if (config.getMaxWaitMs() < 0) {
            throw new JobConfigurationException("max wait must be >= 0, got " + config.getMaxWaitMs());
        }
    }

    private void applyParameters() {
        try {
            indexStore.applyIndexParameters(config.getIndexType(), config.getParameters());
        } catch (RuntimeException e) {
            log.warn("Could not apply index parameters type={} params={} cause={}",
                    config.getIndexType(), config.getParameters(), e.getMessage());
        }
    }

    private CollectionInfo awaitReady(CollectionInfo initial) throws InterruptedException {
        CollectionInfo latest = initial;
        long waitedMs = 0;
        while (!latest.isReady()) {
            if (waitedMs >= config.getMaxWaitMs()) {
                log.warn("Collection {} not ready after {} ms status={}, continuing", latest.name(), waitedMs, latest.status());
                return latest;
            }
            log.info("Collection {} status={}, waiting {} ms", latest.name(), latest.status(), config.getPollIntervalMs());
            sleeper.sleep(Duration.ofMillis(config.getPollIntervalMs()));
            waitedMs += config.getPollIntervalMs();
            latest = indexStore.getCollectionInfo()
                    .orElseThrow(() -> new IndexStoreException(IndexStoreException.Kind.COLLECTION_NOT_FOUND,
                            "Collection " + indexStore.collectionName() + " not found"));
        }
        log.info("Collection {} is ready vectors={}", latest.name(), latest.vectorCount());
        return latest;
    }

    private boolean swapAlias(String collection) {
        String alias = config.getTargetAlias();
        if (alias.isBlank()) {
            return false;
        }
        try {
            indexStore.switchAlias(alias, collection);
        } catch (IndexStoreException e) {
            if (e.kind() != IndexStoreException.Kind.ALIAS_NOT_FOUND) {
                throw e;
            }
            log.info("Alias {} not found, creating it", alias);
            indexStore.createAlias(alias, collection);
        }
        return true;
    }

    private void report(String name, JobPhase phase, String message, JobProgress progress, Boolean aliasSwapped) {
        JobStatus status = JobStatus.of(JobKind.INDEX_JOB, name, phase, message, progress);
        statusReporter.report(aliasSwapped == null ? status : status.withAliasSwapped(aliasSwapped));
    }

    private static String defaultName(String collection) {
        return "index-" + (collection == null ? "" : collection);
    }
}
