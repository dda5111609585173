package com.tokenmetadata.ingestion.pipeline;

import com.tokenmetadata.common.SingleFlightCache;
import com.tokenmetadata.ingestion.dedup.MetadataDedupCache;
import com.tokenmetadata.ingestion.store.QuarantineStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Assembles {@link PipelineHealth} from the coordinator, checkpoint tracker, dedup caches and quarantine store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineMonitor {

    private final PipelineCoordinator coordinator;
    private final CheckpointTracker checkpointTracker;
    private final MetadataDedupCache dedupCache;
    private final QuarantineStore quarantineStore;

    public PipelineHealth snapshot() {
        PipelineStats stats = coordinator.stats();
        SingleFlightCache.Stats cache = dedupCache.stats();
        return new PipelineHealth(
                stats.status(),
                stats.queued(),
                stats.active(),
                stats.awaitingRetry(),
                quarantineCount(stats),
                stats.persisted(),
                stats.stale(),
                checkpointTracker.watermark(),
                new PipelineHealth.CacheCounters(cache.hits(), cache.misses(), cache.joins()),
                Instant.now());
    }

    /** Stored count; this process's counter when the datastore cannot be read. */
    private long quarantineCount(PipelineStats stats) {
        try {
            return quarantineStore.count();
        } catch (DataAccessException e) {
            log.warn("Quarantine count unavailable, reporting in-process count: {}", e.getMessage());
            return stats.quarantined();
        }
    }
}
