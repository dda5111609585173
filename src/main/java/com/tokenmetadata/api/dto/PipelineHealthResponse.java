package com.tokenmetadata.api.dto;

import java.time.Instant;

/**
 * GET /api/v1/pipeline/health response.
 */
public record PipelineHealthResponse(
        String status,
        int queueDepth,
        int activeWorkers,
        int retryQueueSize,
        long quarantineCount,
        long persistedCount,
        long staleCount,
        long checkpoint,
        CacheStats cache,
        Instant timestamp
) {

    public record CacheStats(long hits, long misses, long joins) {
    }
}
