package com.roadspeed.engine.exception;

/**
 * Thrown when the backing database cannot be reached.
 *
 * Not retried inside the service. Retry policy belongs to whoever triggers
 * ingestion.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
