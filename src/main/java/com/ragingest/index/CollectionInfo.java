package com.ragingest.index;

public record CollectionInfo(String name, long vectorCount, String status, int dimension) {
    public static final String READY_STATUS = "green";

    public boolean isReady() {
        return READY_STATUS.equalsIgnoreCase(status);
    }
}
