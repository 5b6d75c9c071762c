package com.shortspilot.orchestrator.store;

/**
 * The persisted tracking document exists but cannot be parsed.
 * Records are never dropped silently: the run stops until an operator looks.
 */
public class StoreCorruptException extends TrackingStoreException {

    public StoreCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
