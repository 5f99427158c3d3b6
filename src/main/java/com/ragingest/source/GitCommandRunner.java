package com.ragingest.source;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class GitCommandRunner {
    private final Duration timeout;
    private final ProcessStarter processStarter;

    public GitCommandRunner(Duration timeout) {
        this(timeout, new NonInteractiveProcessStarter());
    }

    GitCommandRunner(Duration timeout, ProcessStarter processStarter) {
        this.timeout = timeout;
        this.processStarter = processStarter;
    }

    public GitCommandResult run(Path workingDirectory, String... command) {
        List<String> commandLine = List.of(command);
        Process process;
        try {
            process = processStarter.start(workingDirectory, command);
        } catch (IOException e) {
            return new GitCommandResult(commandLine, -1, "", e.getMessage(), GitCommandResult.Termination.LAUNCH_FAILED);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return new GitCommandResult(commandLine, -1, stdout.join(), stderr.join(), GitCommandResult.Termination.TIMED_OUT);
            }
            return new GitCommandResult(commandLine, process.exitValue(), stdout.join(), stderr.join(), GitCommandResult.Termination.EXITED);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new GitCommandResult(commandLine, -1, "", "", GitCommandResult.Termination.INTERRUPTED);
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }).exceptionally(e -> "<output unavailable: " + e.getMessage() + ">");
    }

    interface ProcessStarter {
        Process start(Path workingDirectory, String... command) throws IOException;
    }

    private static final class NonInteractiveProcessStarter implements ProcessStarter {
        @Override
        public Process start(Path workingDirectory, String... command) throws IOException {
            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(workingDirectory == null ? null : workingDirectory.toFile());
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            return builder.start();
        }
    }
}
