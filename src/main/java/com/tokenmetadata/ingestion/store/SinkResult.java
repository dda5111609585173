package com.tokenmetadata.ingestion.store;

/**
 * Outcome of a guarded write.
 */
public enum SinkResult {
    /** Row inserted or overwritten (equal observedAt re-applies). */
    APPLIED,
    /** Stored row has a newer observedAt; nothing written. */
    STALE
}
