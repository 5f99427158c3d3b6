package com.ragingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldIngestThenBuildIndexAgainstLocalStore() throws IOException {
        Path config = writeConfig("mock://fixture");
        Path statusFile = tempDir.resolve("status.json");

        int ingestExit = new CommandLine(new Main(Map.of())).execute(
                "--mode", "ingest",
                "--config", config.toString(),
                "--status-file", statusFile.toString(),
                "handbook");

        assertEquals(Main.EXIT_OK, ingestExit);
        JsonNode ingestStatus = readStatus(statusFile);
        assertEquals("EmbeddingJob", ingestStatus.path("kind").asText());
        assertEquals("Succeeded", ingestStatus.path("phase").asText());
        assertEquals(100, ingestStatus.path("progress").path("percentage").asInt());
        assertTrue(Files.exists(tempDir.resolve("index-store.json")));

        int indexExit = new CommandLine(new Main(Map.of())).execute(
                "--mode", "index",
                "--config", config.toString(),
                "--status-file", statusFile.toString(),
                "--target-alias", "handbook",
                "handbook-index");

        assertEquals(Main.EXIT_OK, indexExit);
        JsonNode indexStatus = readStatus(statusFile);
        assertEquals("IndexJob", indexStatus.path("kind").asText());
        assertEquals("handbook-index", indexStatus.path("name").asText());
        assertEquals("Succeeded", indexStatus.path("phase").asText());
        assertTrue(indexStatus.path("aliasSwapped").asBoolean());
    }

    @Test
    void shouldReturnJobFailureWhenCollectionDoesNotExist() throws IOException {
        Path config = writeConfig("mock://fixture");
        Path statusFile = tempDir.resolve("status.json");

        int exitCode = new CommandLine(new Main(Map.of())).execute(
                "--mode", "index",
                "--config", config.toString(),
                "--status-file", statusFile.toString(),
                "--collection", "missing");

        assertEquals(Main.EXIT_JOB_FAILED, exitCode);
        JsonNode status = readStatus(statusFile);
        assertEquals("Failed", status.path("phase").asText());
        assertEquals("index-missing", status.path("name").asText());
    }

    @Test
    void shouldReturnJobFailureForUnsupportedSourceKind() throws IOException {
        Path config = writeConfig("ftp://example.com/docs");

        int exitCode = new CommandLine(new Main(Map.of())).execute(
                "--mode", "ingest",
                "--config", config.toString(),
                "--status-file", tempDir.resolve("status.json").toString(),
                "handbook");

        assertEquals(Main.EXIT_JOB_FAILED, exitCode);
    }

    @Test
    void shouldReturnUsageErrorForMissingSourceUri() throws IOException {
        Path config = writeConfig("");
        Path statusFile = tempDir.resolve("status.json");

        int exitCode = new CommandLine(new Main(Map.of())).execute(
                "--mode", "ingest",
                "--config", config.toString(),
                "--status-file", statusFile.toString(),
                "handbook");

        assertEquals(Main.EXIT_USAGE, exitCode);
        assertEquals("Failed", readStatus(statusFile).path("phase").asText());
    }

    @Test
    void shouldApplyEnvironmentOverridesBeforeRunning() throws IOException {
        Path config = writeConfig("mock://fixture");

        int exitCode = new CommandLine(new Main(Map.of("CHUNK_OVERLAP", "4096"))).execute(
                "--mode", "ingest",
                "--config", config.toString(),
                "--status-file", tempDir.resolve("status.json").toString(),
                "handbook");

        assertEquals(Main.EXIT_USAGE, exitCode);
    }

    @Test
    void shouldReturnUsageErrorForMalformedEnvironment() throws IOException {
        Path config = writeConfig("mock://fixture");

        int exitCode = new CommandLine(new Main(Map.of("CHUNK_SIZE", "big"))).execute(
                "--mode", "ingest",
                "--config", config.toString(),
                "handbook");

        assertEquals(Main.EXIT_USAGE, exitCode);
    }

    @Test
    void shouldRequireMode() {
        int exitCode = new CommandLine(new Main(Map.of())).execute("handbook");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
    }

    private Path writeConfig(String sourceUri) throws IOException {
        Path config = tempDir.resolve("application.yml");
        Files.writeString(config, """
                ingestion:
                  sourceUri: "%s"
                  batchSize: 2
                index:
                  type: local
                  collection: handbook-v1
                  localPath: "%s"
                  pollIntervalMs: 10
                  maxWaitMs: 0
                embedding:
                  provider: hashing
                  dimension: 16
                """.formatted(sourceUri, tempDir.resolve("index-store.json").toString().replace('\\', '/')));
        return config;
    }

    private static JsonNode readStatus(Path statusFile) throws IOException {
        return new ObjectMapper().readTree(statusFile.toFile());
    }
}
