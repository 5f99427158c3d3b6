package com.ragingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ragingest.embed.EmbeddingClient;
import com.ragingest.embed.EmbeddingClients;
import com.ragingest.index.IndexStore;
import com.ragingest.index.IndexStores;
import com.ragingest.job.IndexBuildJob;
import com.ragingest.job.IndexBuildReport;
import com.ragingest.job.IngestionJob;
import com.ragingest.job.IngestionReport;
import com.ragingest.job.JobConfigurationException;
import com.ragingest.job.JobFailedException;
import com.ragingest.runtime.AppConfig;
import com.ragingest.runtime.EnvironmentOverrides;
import com.ragingest.source.FetcherRegistry;
import com.ragingest.status.StatusReporter;
import com.ragingest.status.StatusReporters;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "rag-ingest",
        mixinStandardHelpOptions = true,
        version = "rag-ingest 0.1.0",
        description = "Runs document ingestion and index-build jobs against a vector collection.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_OK = 0;
    static final int EXIT_JOB_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Job to run: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Parameters(index = "0", arity = "0..1", description = "DocumentSet name (ingest) or IndexJob name (index)")
    String jobId;

    @Option(names = "--source-uri", description = "Overrides the configured source URI")
    String sourceUri;

    @Option(names = "--collection", description = "Overrides the configured vector collection")
    String collection;

    @Option(names = "--target-alias", description = "Overrides the alias switched after an index build")
    String targetAlias;

    @Option(names = "--status-file", description = "Overrides the JSON status file path")
    Path statusFile;

    private final Map<String, String> environment;

    public Main() {
        this(System.getenv());
    }

    Main(Map<String, String> environment) {
        this.environment = environment;
    }

    enum Mode {
        ingest,
        index
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        AppConfig config;
        try {
            config = EnvironmentOverrides.apply(loadConfig(configPath), environment);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration file={} cause={}", configPath, e.getMessage());
            return EXIT_USAGE;
        }
        applyCommandLine(config);

        log.info("Starting rag-ingest in {} mode", mode);
        log.info("Using config file: {}", configPath);
        OkHttpClient httpClient = newHttpClient(config);
        try {
            StatusReporter statusReporter = StatusReporters.fromConfig(config.getStatus(), httpClient, environment);
            IndexStore indexStore = IndexStores.fromConfig(config.getIndex(), httpClient);
            if (mode == Mode.ingest) {
                runIngestion(config, httpClient, indexStore, statusReporter);
            } else {
                runIndexBuild(config, indexStore, statusReporter);
            }
            return EXIT_OK;
        } catch (JobConfigurationException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (JobFailedException e) {
            log.error("{}", e.getMessage());
            return EXIT_JOB_FAILED;
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    private void runIngestion(AppConfig config, OkHttpClient httpClient, IndexStore indexStore, StatusReporter statusReporter)
            throws JobFailedException {
        EmbeddingClient embeddingClient = EmbeddingClients.fromConfig(config.getEmbedding(), httpClient);
        try (FetcherRegistry fetchers = FetcherRegistry.defaults(config.getSource(), httpClient)) {
            IngestionJob job = new IngestionJob(config.getIngestion(), fetchers, embeddingClient, indexStore, statusReporter);
            IngestionReport report = job.run(jobId);
            log.info("Ingested documentSet={} collection={} documents={} chunks={} batches={}",
                    report.documentSet(),
                    report.collection(),
                    report.documents(),
                    report.processedChunks(),
                    report.batches());
        }
    }

    private void runIndexBuild(AppConfig config, IndexStore indexStore, StatusReporter statusReporter)
            throws JobFailedException {
        String name = jobId == null || jobId.isBlank() ? config.getStatus().getIndexJobName() : jobId;
        IndexBuildReport report = new IndexBuildJob(config.getIndex(), indexStore, statusReporter).run(name);
        log.info("Built index name={} collection={} vectors={} ready={} alias={} aliasSwapped={}",
                report.name(),
                report.collection(),
                report.vectorCount(),
                report.ready(),
                report.targetAlias().isBlank() ? "none" : report.targetAlias(),
                report.aliasSwapped());
    }

    private void applyCommandLine(AppConfig config) {
        if (sourceUri != null) {
            config.getIngestion().setSourceUri(sourceUri);
        }
        if (collection != null) {
            config.getIndex().setCollection(collection);
        }
        if (targetAlias != null) {
            config.getIndex().setTargetAlias(targetAlias);
        }
        if (statusFile != null) {
            config.getStatus().setFilePath(statusFile.toString());
        }
    }

    private static OkHttpClient newHttpClient(AppConfig config) {
        int timeoutMs = Math.max(config.getIndex().getTimeoutMs(), config.getEmbedding().getTimeoutMs());
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofMillis(timeoutMs))
                .writeTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    private static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
