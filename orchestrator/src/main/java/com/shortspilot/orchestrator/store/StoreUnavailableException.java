package com.shortspilot.orchestrator.store;

/**
 * The tracking store cannot be read or written at all (I/O error, lock failure).
 */
public class StoreUnavailableException extends TrackingStoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
