package com.tokenmetadata.ingestion.pipeline;

/**
 * How an event left the pipeline. Every outcome except ABANDONED counts as handled for checkpointing.
 */
public enum EventOutcome {
    PERSISTED,
    /** A newer observedAt is already stored for the token. */
    STALE,
    QUARANTINED,
    /** Dropped during shutdown before completing; redelivered after restart. */
    ABANDONED;

    public boolean isHandled() {
        return this != ABANDONED;
    }
}
