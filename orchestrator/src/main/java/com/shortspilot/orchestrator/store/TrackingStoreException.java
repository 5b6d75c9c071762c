package com.shortspilot.orchestrator.store;

/**
 * Base class for failures raised by a {@link TrackingStore}.
 * The scheduler skips one item on {@link StaleWriteException} and aborts the
 * run on the other subclasses.
 */
public class TrackingStoreException extends RuntimeException {

    public TrackingStoreException(String message) {
        super(message);
    }

    public TrackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
