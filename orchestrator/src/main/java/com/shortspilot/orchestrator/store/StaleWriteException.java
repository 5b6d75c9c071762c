package com.shortspilot.orchestrator.store;

/**
 * A record was changed by another writer since it was loaded.
 *
 * @see TrackingStore#upsert
 */
public class StaleWriteException extends TrackingStoreException {

    private final String recordKey;
    private final long   expectedVersion;
    private final long   actualVersion;

    public StaleWriteException(String recordKey, long expectedVersion, long actualVersion) {
        super("Stale write for " + recordKey + ": expected version " + expectedVersion
              + " but store has " + actualVersion);
        this.recordKey       = recordKey;
        this.expectedVersion = expectedVersion;
        this.actualVersion   = actualVersion;
    }

    public String getRecordKey()      { return recordKey; }
    public long   getExpectedVersion() { return expectedVersion; }
    public long   getActualVersion()   { return actualVersion; }
}
