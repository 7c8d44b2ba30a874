package com.roadspeed.engine.exception;

/**
 * Thrown when input is malformed: a negative or non-finite measurement, a
 * missing timestamp, a missing segment id.
 *
 * Callers must fix the input; the service never retries these.
 */
public class ValidationFailedException extends RuntimeException {

    public ValidationFailedException(String message) {
        super(message);
    }
}
