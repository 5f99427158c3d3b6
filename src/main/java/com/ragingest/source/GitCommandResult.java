package com.ragingest.source;

import java.util.List;

public record GitCommandResult(
        List<String> command,
        int exitCode,
        String stdout,
        String stderr,
        Termination termination) {

    public enum Termination {
        EXITED,
        TIMED_OUT,
        INTERRUPTED,
        LAUNCH_FAILED
    }

    public boolean isSuccess() {
        return termination == Termination.EXITED && exitCode == 0;
    }

    public String describeFailure() {
        String detail = stderr == null || stderr.isBlank() ? stdout : stderr;
        return String.join(" ", command) + " -> " + termination.name().toLowerCase() + " exitCode=" + exitCode
                + (detail == null || detail.isBlank() ? "" : " output=" + detail);
    }
}
