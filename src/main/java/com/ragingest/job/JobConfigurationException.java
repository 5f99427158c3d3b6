package com.ragingest.job;

public class JobConfigurationException extends RuntimeException {
    public JobConfigurationException(String message) {
        super(message);
    }
}
