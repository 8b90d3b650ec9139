package com.sandy.agentops.alerting.service;

/**
 * The time series backend could not be reached. Callers retry on their next run.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
