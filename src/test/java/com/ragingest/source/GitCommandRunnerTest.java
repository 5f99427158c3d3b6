package com.ragingest.source;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitCommandRunnerTest {

    @Test
    void shouldCaptureOutputOfFailedClone() {
        GitCommandRunner runner = new GitCommandRunner(Duration.ofSeconds(1),
                (workingDirectory, command) -> new FakeProcess(128, true, false, "", "fatal: repository not found"));

        GitCommandResult result = runner.run(null, "git", "clone", "--depth", "1", "https://example.com/missing.git", "/tmp/x");

        assertEquals(128, result.exitCode());
        assertEquals(GitCommandResult.Termination.EXITED, result.termination());
        assertEquals("fatal: repository not found", result.stderr());
        assertEquals(List.of("git", "clone", "--depth", "1", "https://example.com/missing.git", "/tmp/x"), result.command());
        assertFalse(result.isSuccess());
        assertTrue(result.describeFailure().contains("repository not found"));
    }

    @Test
    void shouldReportLaunchFailureWhenGitIsMissing() {
        GitCommandRunner runner = new GitCommandRunner(Duration.ofSeconds(1), (workingDirectory, command) -> {
            throw new IOException("Cannot run program \"git\"");
        });

        GitCommandResult result = runner.run(Path.of("."), "git", "rev-parse", "HEAD");

        assertEquals(GitCommandResult.Termination.LAUNCH_FAILED, result.termination());
        assertFalse(result.isSuccess());
    }

    @Test
    void shouldMarkInterruptedAndRestoreInterruptFlag() {
        GitCommandRunner runner = new GitCommandRunner(Duration.ofSeconds(1),
                (workingDirectory, command) -> new FakeProcess(0, true, true, "", ""));

        GitCommandResult result = runner.run(Path.of("."), "git", "clone");

        assertEquals(GitCommandResult.Termination.INTERRUPTED, result.termination());
        assertTrue(Thread.currentThread().isInterrupted());
        Thread.interrupted();
    }

    @Test
    void shouldKillCloneThatExceedsTimeout() {
        FakeProcess process = new FakeProcess(0, false, false, "", "");
        GitCommandRunner runner = new GitCommandRunner(Duration.ofMillis(5), (workingDirectory, command) -> process);

        GitCommandResult result = runner.run(null, "git", "clone");

        assertEquals(GitCommandResult.Termination.TIMED_OUT, result.termination());
        assertTrue(process.destroyForciblyCalled);
        assertFalse(result.isSuccess());
    }

    private static class FakeProcess extends Process {
        private final int exitCode;
        private final boolean finishes;
        private final boolean interruptsWait;
        private final InputStream stdout;
        private final InputStream stderr;

        private boolean destroyForciblyCalled;

        private FakeProcess(int exitCode, boolean finishes, boolean interruptsWait, String stdout, String stderr) {
            this.exitCode = exitCode;
            this.finishes = finishes;
            this.interruptsWait = interruptsWait;
            this.stdout = new ByteArrayInputStream(stdout.getBytes(StandardCharsets.UTF_8));
            this.stderr = new ByteArrayInputStream(stderr.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (interruptsWait) {
                throw new InterruptedException("interrupted");
            }
            return finishes;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            // no-op
        }

        @Override
        public Process destroyForcibly() {
            destroyForciblyCalled = true;
            return this;
        }

        @Override
        public boolean isAlive() {
            return false;
        }
    }
}
