package com.ragingest.status;

@FunctionalInterface
public interface StatusReporter {
    void report(JobStatus status);
}
