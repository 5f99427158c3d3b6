package com.ragingest.job;

public class JobFailedException extends Exception {
    public JobFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
