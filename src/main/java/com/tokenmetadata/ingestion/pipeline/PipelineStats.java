package com.tokenmetadata.ingestion.pipeline;

/**
 * Point-in-time coordinator counters.
 *
 * @param queued        events waiting for a worker
 * @param active        events a worker is processing
 * @param awaitingRetry events parked on a retry timer
 * @param inFlight      events submitted without an outcome yet
 */
public record PipelineStats(
        PipelineStatus status,
        int queued,
        int active,
        int awaitingRetry,
        int inFlight,
        long persisted,
        long stale,
        long quarantined,
        long abandoned
) {
}
