package com.tokenmetadata.api.controller;

import com.tokenmetadata.api.dto.PipelineHealthResponse;
import com.tokenmetadata.ingestion.pipeline.PipelineHealth;
import com.tokenmetadata.ingestion.pipeline.PipelineMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /pipeline/health: queue depth, retry queue, quarantine count, checkpoint and cache counters.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineHealthController {

    private final PipelineMonitor pipelineMonitor;

    @GetMapping("/health")
    public ResponseEntity<PipelineHealthResponse> health() {
        return ResponseEntity.ok(toResponse(pipelineMonitor.snapshot()));
    }

    private static PipelineHealthResponse toResponse(PipelineHealth h) {
        return new PipelineHealthResponse(
                h.status().name(),
                h.queueDepth(),
                h.activeWorkers(),
                h.retryQueueSize(),
                h.quarantineCount(),
                h.persistedCount(),
                h.staleCount(),
                h.checkpoint(),
                new PipelineHealthResponse.CacheStats(h.cache().hits(), h.cache().misses(), h.cache().joins()),
                h.timestamp());
    }
}
