package com.ragingest.status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JobStatusReporter implements StatusReporter {
    private static final Logger log = LoggerFactory.getLogger(JobStatusReporter.class);

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path statusFile;
    private final StatusPatchClient patchClient;

    public JobStatusReporter(Path statusFile) {
        this(statusFile, null);
    }

    public JobStatusReporter(Path statusFile, StatusPatchClient patchClient) {
        this.statusFile = statusFile;
        this.patchClient = patchClient;
    }

    @Override
    public void report(JobStatus status) {
        log.info("{} {} phase={} progress={}/{} ({}%) message={}",
                status.kind().resourceKind(),
                status.name(),
                status.phase().label(),
                status.progress().processed(),
                status.progress().total(),
                status.progress().percentage(),
                status.message());
        writeFile(status);
        patch(status);
    }

    private void writeFile(JobStatus status) {
        if (statusFile == null) {
            return;
        }
        try {
            Path parent = statusFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(statusFile.toFile(), status);
        } catch (IOException e) {
            log.warn("Failed to write status file={} cause={}", statusFile, e.getMessage());
        }
    }

    private void patch(JobStatus status) {
        if (patchClient == null) {
            return;
        }
        try {
            patchClient.patch(status);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to patch {} {} status cause={}", status.kind().resourceKind(), status.name(), e.getMessage());
        }
    }
}
