package com.ragingest.job;

public record IndexBuildReport(
        String name,
        String collection,
        long vectorCount,
        boolean ready,
        String targetAlias,
        boolean aliasSwapped) {
}
