package com.tokenmetadata.ingestion.pipeline;

import java.time.Instant;

/**
 * Operational snapshot of the pipeline.
 *
 * @param queueDepth      events waiting for a worker
 * @param activeWorkers   workers currently processing an event
 * @param retryQueueSize  events parked until their backoff elapses
 * @param quarantineCount events in quarantined_events
 * @param checkpoint      source sequence up to which every event has an outcome
 */
public record PipelineHealth(
        PipelineStatus status,
        int queueDepth,
        int activeWorkers,
        int retryQueueSize,
        long quarantineCount,
        long persistedCount,
        long staleCount,
        long checkpoint,
        CacheCounters cache,
        Instant timestamp
) {

    public record CacheCounters(long hits, long misses, long joins) {
    }
}
