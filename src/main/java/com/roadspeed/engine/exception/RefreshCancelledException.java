package com.roadspeed.engine.exception;

/**
 * Thrown when a latest-speed refresh is interrupted mid-sweep.
 * The previously published snapshot is left in place.
 */
public class RefreshCancelledException extends RuntimeException {

    public RefreshCancelledException(String message) {
        super(message);
    }
}
