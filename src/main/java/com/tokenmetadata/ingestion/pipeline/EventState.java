package com.tokenmetadata.ingestion.pipeline;

/**
 * Per-event pipeline state. FAILED_RETRYABLE loops back to FETCHING after backoff.
 */
public enum EventState {
    RECEIVED,
    FETCHING,
    VALIDATING,
    CACHING,
    PERSISTING,
    DONE,
    FAILED_RETRYABLE,
    QUARANTINED;

    public boolean isTerminal() {
        return this == DONE || this == QUARANTINED;
    }
}
